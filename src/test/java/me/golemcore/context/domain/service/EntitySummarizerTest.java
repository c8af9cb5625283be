package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.Deadline;
import me.golemcore.context.domain.model.Event;
import me.golemcore.context.domain.model.Note;
import me.golemcore.context.domain.model.OpenLoop;
import me.golemcore.context.domain.model.Opportunity;
import me.golemcore.context.domain.model.Person;
import me.golemcore.context.domain.model.Place;
import me.golemcore.context.domain.model.Project;
import me.golemcore.context.domain.model.Routine;
import me.golemcore.context.domain.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EntitySummarizerTest {

    private EntitySummarizer summarizer;

    @BeforeEach
    void setUp() {
        summarizer = new EntitySummarizer(Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldSummarizePersonWithAvailableParts() {
        Person full = Person.builder().id("p1").name("Alice Smith").title("CTO").company("Acme")
                .email("alice@acme.com").build();
        Person bare = Person.builder().id("p2").name("Bob").build();

        assertEquals("Alice Smith CTO at Acme (alice@acme.com)", summarizer.summarize(full));
        assertEquals("Bob", summarizer.summarize(bare));
        assertEquals("Alice Smith", summarizer.displayName(full));
    }

    @Test
    void shouldSummarizePlaceAsCommaSeparatedAddress() {
        Place place = Place.builder().id("pl1").name("Blue Bottle").address("1 Main St").city("Oakland").build();

        assertEquals("Blue Bottle, 1 Main St, Oakland", summarizer.summarize(place));
    }

    @Test
    void shouldSummarizeDatedEntitiesWithIsoDates() {
        Event event = Event.builder().id("e1").title("Standup").startsAt(Instant.parse("2026-03-02T09:00:00Z"))
                .location("Room 1").build();
        Task task = Task.builder().id("t1").title("Write report").status("pending")
                .dueDate(Instant.parse("2026-03-05T17:00:00Z")).build();
        Deadline deadline = Deadline.builder().id("d1").title("Taxes").status("pending")
                .dueAt(Instant.parse("2026-04-15T23:00:00Z")).build();
        OpenLoop openLoop = OpenLoop.builder().id("o1").title("Reply to Bob").status("open")
                .dueAt(Instant.parse("2026-03-03T12:00:00Z")).build();
        Project project = Project.builder().id("pr1").name("Apollo").status("active")
                .dueDate(Instant.parse("2026-06-01T00:00:00Z")).build();

        assertEquals("Standup on 2026-03-02 at Room 1", summarizer.summarize(event));
        assertEquals("Write report [pending] due 2026-03-05", summarizer.summarize(task));
        assertEquals("Taxes due 2026-04-15 [pending]", summarizer.summarize(deadline));
        assertEquals("Reply to Bob due 2026-03-03 [open]", summarizer.summarize(openLoop));
        assertEquals("Apollo [active] due 2026-06-01", summarizer.summarize(project));
    }

    @Test
    void shouldOmitMissingDates() {
        Task task = Task.builder().id("t1").title("Someday").status("pending").build();
        Event event = Event.builder().id("e1").title("Party").build();

        assertEquals("Someday [pending]", summarizer.summarize(task));
        assertEquals("Party", summarizer.summarize(event));
    }

    @Test
    void shouldSummarizeRoutineWithFrequency() {
        Routine routine = Routine.builder().id("r1").name("Morning run").frequency("daily").status("active")
                .build();

        assertEquals("Morning run (daily) [active]", summarizer.summarize(routine));
        assertEquals("Morning run", summarizer.displayName(routine));
    }

    @Test
    void shouldTruncateNoteContentAndFallBackToUntitled() {
        String content = "a".repeat(60);
        Note titled = Note.builder().id("n1").title("Ideas").content(content).build();
        Note untitled = Note.builder().id("n2").content("buy milk").build();

        assertEquals("Ideas: " + "a".repeat(50) + "...", summarizer.summarize(titled));
        assertEquals("Untitled: buy milk", summarizer.summarize(untitled));
        assertEquals("Untitled Note", summarizer.displayName(untitled));
    }

    @Test
    void shouldFallBackToPlaceholderWhenPrimaryLabelMissing() {
        Person nameless = Person.builder().id("p9").company("Acme").build();
        OpenLoop untitledLoop = OpenLoop.builder().id("ol9").status("open").build();

        assertEquals("Untitled at Acme", summarizer.summarize(nameless));
        assertEquals("Untitled Person", summarizer.displayName(nameless));
        assertEquals("Untitled [open]", summarizer.summarize(untitledLoop));
        assertEquals("Untitled Open Loop", summarizer.displayName(untitledLoop));
    }

    @Test
    void shouldHideGeneralOpportunityType() {
        Opportunity grant = Opportunity.builder().id("op1").title("Research grant").status("open").type("funding")
                .expiresAt(Instant.parse("2026-05-01T00:00:00Z")).build();
        Opportunity general = Opportunity.builder().id("op2").title("Side gig").status("open").type("general")
                .build();

        assertEquals("Research grant [open] (funding) expires 2026-05-01", summarizer.summarize(grant));
        assertEquals("Side gig [open]", summarizer.summarize(general));
    }

    @Test
    void shouldRenderDatesInClockZone() {
        EntitySummarizer newYork = new EntitySummarizer(
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneId.of("America/New_York")));
        Event lateEvening = Event.builder().id("e1").title("Call")
                .startsAt(Instant.parse("2026-03-02T03:00:00Z")).build();

        assertEquals("Call on 2026-03-01", newYork.summarize(lateEvening));
    }
}
