package com.recordsearch.embeddings.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.service.storage.Dataset;
import com.recordsearch.embeddings.service.storage.DatasetField;
import com.recordsearch.embeddings.service.storage.DatasetRecord;
import com.recordsearch.embeddings.service.storage.FieldType;

import lombok.RequiredArgsConstructor;

/** Builds the text that is sent for embedding, from one field or from a whole record. */
@Component
@RequiredArgsConstructor
public class RecordTextBuilder {

  private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
  private static final Pattern REPEATED_SPACES = Pattern.compile(" {2,}");

  private final ApplicationProperties properties;

  /**
   * Text of a single field; markup is removed from editor fields.
   *
   * @param record the record
   * @param field the field to read
   * @return the field text, empty when unset
   */
  public String fieldText(DatasetRecord record, DatasetField field) {
    String value = record.getString(field.getName());
    return field.getType() == FieldType.EDITOR ? stripHtml(value) : value;
  }

  /**
   * Text representing a whole record. With a template, every {@code {fieldName}} placeholder is
   * replaced by that field's value. Without one, each non-empty text, editor, email or url field
   * becomes a {@code name: value} line, with long values truncated.
   *
   * @param record the record
   * @param dataset the record's dataset, for its field list
   * @param template optional template, may be null or blank
   */
  public String recordText(DatasetRecord record, Dataset dataset, String template) {
    if (template != null && !template.isBlank()) {
      String result = template;
      for (DatasetField field : dataset.getFields()) {
        result = result.replace("{" + field.getName() + "}", fieldText(record, field));
      }
      return result.trim();
    }

    int maxChars = properties.getGeneration().getMaxFieldChars();
    List<String> parts = new ArrayList<>();
    for (DatasetField field : dataset.getFields()) {
      if (field.getType() == null || !field.getType().isTextual()) {
        continue;
      }
      String value = fieldText(record, field);
      if (value.isEmpty()) {
        continue;
      }
      if (value.length() > maxChars) {
        value = value.substring(0, maxChars) + "...";
      }
      parts.add(field.getName() + ": " + value);
    }
    return String.join("\n", parts);
  }

  /** Replace markup tags with spaces and collapse the resulting runs of spaces. */
  public static String stripHtml(String html) {
    if (html == null || html.isEmpty()) {
      return "";
    }
    String text = HTML_TAG.matcher(html).replaceAll(" ");
    return REPEATED_SPACES.matcher(text).replaceAll(" ").trim();
  }
}
