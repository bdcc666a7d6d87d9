package io.kalends.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.kalends.CalendarException;
import io.kalends.CalendarKind;
import io.kalends.CivilDate;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson module binding {@link CivilDate} to its plain-field JSON form.
 *
 * <pre>{@code
 * {"year": 1995, "month": 8, "day": 15, "calendar": "julian"}
 * }</pre>
 *
 * <p>The calendar is written as its {@link CalendarKind#tag()}. Reading validates the date through
 * {@link CivilDate#of(int, int, int, CalendarKind)}; a rejected date surfaces as a {@link
 * JsonMappingException} whose cause is the {@link CalendarException}.
 */
public final class CivilDateModule extends SimpleModule {
  private static final long serialVersionUID = 1L;

  private static final Logger LOG = LoggerFactory.getLogger(CivilDateModule.class);

  static final String YEAR = "year";
  static final String MONTH = "month";
  static final String DAY = "day";
  static final String CALENDAR = "calendar";

  /** Creates the module. */
  public CivilDateModule() {
    super("kalends-civil-date");
    addSerializer(CivilDate.class, new CivilDateSerializer());
    addDeserializer(CivilDate.class, new CivilDateDeserializer());
  }

  static final class CivilDateSerializer extends StdSerializer<CivilDate> {
    private static final long serialVersionUID = 1L;

    CivilDateSerializer() {
      super(CivilDate.class);
    }

    @Override
    public void serialize(CivilDate value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      gen.writeNumberField(YEAR, value.year());
      gen.writeNumberField(MONTH, value.month());
      gen.writeNumberField(DAY, value.day());
      gen.writeStringField(CALENDAR, value.calendar().tag());
      gen.writeEndObject();
    }
  }

  static final class CivilDateDeserializer extends StdDeserializer<CivilDate> {
    private static final long serialVersionUID = 1L;

    CivilDateDeserializer() {
      super(CivilDate.class);
    }

    @Override
    public CivilDate deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = p.readValueAsTree();
      if (node == null || !node.isObject()) {
        throw JsonMappingException.from(p, "expected a civil date object");
      }
      int year = intField(p, node, YEAR);
      int month = intField(p, node, MONTH);
      int day = intField(p, node, DAY);
      JsonNode calendar = node.get(CALENDAR);
      if (calendar == null || !calendar.isTextual()) {
        throw JsonMappingException.from(p, "missing or non-text field '" + CALENDAR + "'");
      }
      try {
        return CivilDate.of(year, month, day, CalendarKind.fromTag(calendar.asText()));
      } catch (CalendarException e) {
        LOG.debug("Rejected civil date payload {}: {}", node, e.getMessage());
        throw JsonMappingException.from(p, e.getMessage(), e);
      }
    }

    private static int intField(JsonParser p, JsonNode node, String name)
        throws JsonMappingException {
      JsonNode field = node.get(name);
      if (field == null || !field.isIntegralNumber() || !field.canConvertToInt()) {
        throw JsonMappingException.from(p, "missing or non-integer field '" + name + "'");
      }
      return field.intValue();
    }
  }
}
