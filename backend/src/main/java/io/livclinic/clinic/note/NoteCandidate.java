package io.livclinic.clinic.note;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * An untrusted incoming note entry. {@code id} and {@code completed} may be null: a null id (or
 * one that matches nothing) means a new note, a null {@code completed} means "keep" on edits and
 * {@code false} on new notes.
 */
public record NoteCandidate(String id, String text, Boolean completed) {

  private static final List<String> TEXT_KEYS = List.of("text", "note", "value", "description");
  private static final List<String> ID_KEYS = List.of("id", "_id", "uuid");

  public static NoteCandidate ofText(String text) {
    return new NoteCandidate(null, text, null);
  }

  /**
   * Reads candidates from loosely shaped JSON. Accepted entries are plain strings, objects keyed by
   * any of the text and id aliases, nested arrays, and objects whose {@code text} is itself an
   * array (each element inherits the parent's other fields). Anything else is skipped.
   */
  public static List<NoteCandidate> fromJson(Collection<? extends JsonNode> entries) {
    List<NoteCandidate> candidates = new ArrayList<>();
    if (entries != null) {
      for (JsonNode entry : entries) {
        collect(entry, candidates);
      }
    }
    return candidates;
  }

  private static void collect(JsonNode node, List<NoteCandidate> out) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return;
    }
    if (node.isArray()) {
      node.forEach(child -> collect(child, out));
      return;
    }
    if (node.isTextual()) {
      out.add(ofText(node.textValue()));
      return;
    }
    if (!node.isObject()) {
      return;
    }
    JsonNode text = node.get("text");
    if (text != null && text.isArray()) {
      ObjectNode parent = ((ObjectNode) node).deepCopy();
      parent.remove("text");
      for (JsonNode child : text) {
        ObjectNode merged = parent.deepCopy();
        if (child.isObject()) {
          merged.setAll((ObjectNode) child);
        } else {
          merged.set("text", child);
        }
        collect(merged, out);
      }
      return;
    }
    out.add(
        new NoteCandidate(
            firstNonBlank(node, ID_KEYS),
            firstNonBlank(node, TEXT_KEYS),
            completedFlag(node.get("completed"))));
  }

  private static String firstNonBlank(JsonNode node, List<String> keys) {
    for (String key : keys) {
      JsonNode value = node.get(key);
      if (value != null && value.isValueNode() && !value.isNull()) {
        String text = value.asText();
        if (!text.isBlank()) {
          return text;
        }
      }
    }
    return null;
  }

  private static Boolean completedFlag(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    return value.asBoolean();
  }
}
