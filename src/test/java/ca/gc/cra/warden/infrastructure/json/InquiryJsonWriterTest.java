package ca.gc.cra.warden.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.moderation.ActiveClaim;
import ca.gc.cra.warden.domain.moderation.Inquiry;
import ca.gc.cra.warden.domain.moderation.LightUser;
import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import ca.gc.cra.warden.domain.moderation.Note;
import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.moderation.ReportReason;
import ca.gc.cra.warden.domain.moderation.User;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class InquiryJsonWriterTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private final Report r1 = new Report("R1", "U1", "alice", ReportReason.CHEAT, "engine \"use\"", T0, null, false,
      new ActiveClaim("m", T0));
  private final Report r2 = new Report("R2", "U1", "bob", ReportReason.BOOST, "again", T0, null, false, null);
  private final User u1 = new User("u1", "U1", null, true, true, false, false, T0);
  private final Note note = new Note("m", "u1", "watch", true, T0);
  private final ModlogEntry entry = new ModlogEntry("m", "u1", "alert", null, T0);

  @Test
  void rendersEveryComponent() {
    Inquiry inquiry = new Inquiry(new LightUser("m", "M", "NM"), r1, OptionalInt.of(87),
        List.of(r2), List.of(note), List.of(entry), u1);

    Map<?, ?> doc = (Map<?, ?>) new JsonSupport().parse(new InquiryJsonWriter(false).toJson(inquiry));

    assertEquals(Map.of("id", "m", "name", "M", "title", "NM"), doc.get("mod"));
    Map<?, ?> report = (Map<?, ?>) doc.get("report");
    assertEquals("R1", report.get("id"));
    assertEquals("cheat", report.get("reason"));
    assertEquals("engine \"use\"", report.get("text"));
    assertEquals(Map.of("mod", "m", "seenAt", "2024-03-01T10:00:00Z"), report.get("inquiry"));
    assertFalse(report.containsKey("processedBy"));
    assertEquals(87, ((Number) doc.get("accuracy")).intValue());
    assertEquals(1, ((List<?>) doc.get("moreReports")).size());
    assertEquals(List.of("R1", "R2"), doc.get("allReports"));
    assertEquals(1, ((List<?>) doc.get("notes")).size());
    Map<?, ?> history = (Map<?, ?>) ((List<?>) doc.get("history")).get(0);
    assertEquals("alert", history.get("action"));
    assertFalse(history.containsKey("details"));
    Map<?, ?> user = (Map<?, ?>) doc.get("user");
    assertEquals("U1", user.get("username"));
    assertEquals(Boolean.TRUE, user.get("engine"));
  }

  @Test
  void omitsAbsentAccuracy() {
    Inquiry inquiry = new Inquiry(new LightUser("m", "M", null), r1, OptionalInt.empty(),
        List.of(), List.of(), List.of(), u1);

    String json = new InquiryJsonWriter(false).toJson(inquiry);
    Map<?, ?> doc = (Map<?, ?>) new JsonSupport().parse(json);

    assertFalse(doc.containsKey("accuracy"));
    assertFalse(((Map<?, ?>) doc.get("mod")).containsKey("title"));
    assertEquals(List.of("R1"), doc.get("allReports"));
    assertFalse(json.contains("\n"));
  }

  @Test
  void prettyOutputIsIndented() {
    Inquiry inquiry = new Inquiry(new LightUser("m", "M", null), r1, OptionalInt.empty(),
        List.of(), List.of(), List.of(), u1);

    assertTrue(new InquiryJsonWriter(true).toJson(inquiry).contains("\n"));
  }
}
