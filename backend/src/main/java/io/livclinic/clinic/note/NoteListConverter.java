package io.livclinic.clinic.note;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Persists a note list as a JSON array in a TEXT column. */
@Converter
public class NoteListConverter implements AttributeConverter<List<Note>, String> {

  private static final Logger log = LoggerFactory.getLogger(NoteListConverter.class);

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .findAndAddModules()
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .build();
  private static final TypeReference<List<Note>> NOTE_LIST = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<Note> attribute) {
    try {
      return MAPPER.writeValueAsString(attribute != null ? attribute : List.of());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Note list is not serializable as JSON", e);
    }
  }

  @Override
  public List<Note> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return List.of();
    }
    try {
      List<Note> notes = MAPPER.readValue(dbData, NOTE_LIST);
      return notes != null ? notes : List.of();
    } catch (JsonProcessingException e) {
      log.warn("Discarding unreadable stored note list: {}", e.getOriginalMessage());
      return List.of();
    }
  }
}
