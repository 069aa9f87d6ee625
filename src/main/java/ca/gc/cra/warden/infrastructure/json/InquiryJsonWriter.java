package ca.gc.cra.warden.infrastructure.json;

import ca.gc.cra.warden.domain.moderation.Inquiry;
import ca.gc.cra.warden.domain.moderation.LightUser;
import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import ca.gc.cra.warden.domain.moderation.Note;
import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.moderation.User;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Renders an {@link Inquiry} as a JSON object for command-line and dashboard consumers.
 * <p>Absent accuracy, titles and claims are omitted rather than written as {@code null}. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InquiryJsonWriter {
  private final JsonFactory factory = new JsonFactory();
  private final boolean pretty;

  /**
   * Creates a writer.
   *
   * @param pretty whether to indent output
   */
  public InquiryJsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Renders the inquiry to a string.
   *
   * @param inquiry inquiry to render; must not be {@code null}
   * @return JSON document
   */
  public String toJson(Inquiry inquiry) {
    StringWriter out = new StringWriter(1024);
    try {
      write(inquiry, out);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render inquiry", ex);
    }
    return out.toString();
  }

  /**
   * Renders the inquiry to {@code out}; the writer is flushed but not closed.
   *
   * @param inquiry inquiry to render
   * @param out destination
   * @throws IOException when writing fails
   */
  public void write(Inquiry inquiry, Writer out) throws IOException {
    Objects.requireNonNull(inquiry, "inquiry");
    Objects.requireNonNull(out, "out");
    JsonGenerator gen = factory.createGenerator(out);
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    if (pretty) {
      gen.useDefaultPrettyPrinter();
    }
    try (gen) {
      gen.writeStartObject();
      gen.writeFieldName("mod");
      writeLightUser(gen, inquiry.mod());
      gen.writeFieldName("report");
      writeReport(gen, inquiry.report());
      if (inquiry.accuracy().isPresent()) {
        gen.writeNumberField("accuracy", inquiry.accuracy().getAsInt());
      }
      gen.writeArrayFieldStart("moreReports");
      for (Report report : inquiry.moreReports()) {
        writeReport(gen, report);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("allReports");
      for (Report report : inquiry.allReports()) {
        gen.writeString(report.id());
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("notes");
      for (Note note : inquiry.notes()) {
        writeNote(gen, note);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("history");
      for (ModlogEntry entry : inquiry.history()) {
        writeHistory(gen, entry);
      }
      gen.writeEndArray();
      gen.writeFieldName("user");
      writeUser(gen, inquiry.user());
      gen.writeEndObject();
    }
    out.flush();
  }

  private void writeLightUser(JsonGenerator gen, LightUser user) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", user.id());
    gen.writeStringField("name", user.name());
    if (user.title() != null) {
      gen.writeStringField("title", user.title());
    }
    gen.writeEndObject();
  }

  private void writeReport(JsonGenerator gen, Report report) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", report.id());
    gen.writeStringField("user", report.subject());
    gen.writeStringField("reporter", report.reporter());
    gen.writeStringField("reason", report.reason().key());
    gen.writeStringField("text", report.text());
    gen.writeStringField("createdAt", report.createdAt().toString());
    if (report.processedBy() != null) {
      gen.writeStringField("processedBy", report.processedBy());
      gen.writeBooleanField("actioned", report.actioned());
    }
    if (report.claim() != null) {
      gen.writeObjectFieldStart("inquiry");
      gen.writeStringField("mod", report.claim().moderatorId());
      gen.writeStringField("seenAt", report.claim().seenAt().toString());
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private void writeNote(JsonGenerator gen, Note note) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("from", note.author());
    gen.writeStringField("to", note.userId());
    gen.writeStringField("text", note.text());
    gen.writeBooleanField("modOnly", note.modOnly());
    gen.writeStringField("date", note.createdAt().toString());
    gen.writeEndObject();
  }

  private void writeHistory(JsonGenerator gen, ModlogEntry entry) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("mod", entry.moderatorId());
    gen.writeStringField("user", entry.userId());
    gen.writeStringField("action", entry.action());
    if (entry.details() != null) {
      gen.writeStringField("details", entry.details());
    }
    gen.writeStringField("date", entry.createdAt().toString());
    gen.writeEndObject();
  }

  private void writeUser(JsonGenerator gen, User user) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", user.id());
    gen.writeStringField("username", user.username());
    if (user.title() != null) {
      gen.writeStringField("title", user.title());
    }
    gen.writeBooleanField("enabled", user.enabled());
    gen.writeBooleanField("engine", user.engine());
    gen.writeBooleanField("booster", user.booster());
    gen.writeBooleanField("troll", user.troll());
    gen.writeStringField("createdAt", user.createdAt().toString());
    gen.writeEndObject();
  }
}
