package com.gentoro.labasset.record;

/** An item type of the record system, whose body describes the fields of an asset. */
public record RecordTemplate(int id, String title, String body, String color) {

  /** Template description handed to the inference provider. HTML markup is removed. */
  public String structure() {
    String text = body == null ? "" : body.replaceAll("<[^>]+>", "").strip();
    return "Template name: " + title + "\n\nTemplate structure:\n" + text;
  }
}
