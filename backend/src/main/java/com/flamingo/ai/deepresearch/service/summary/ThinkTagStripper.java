package com.flamingo.ai.deepresearch.service.summary;

/**
 * Removes {@code <think>...</think>} reasoning spans from model output.
 *
 * <p>Balanced spans are removed repeatedly until none remain. An opening tag left without a closing
 * tag starts reasoning that was cut off, so it is removed with everything after it. Text without
 * tags is returned unchanged.
 */
public final class ThinkTagStripper {

  static final String OPEN = "<think>";
  static final String CLOSE = "</think>";

  private ThinkTagStripper() {}

  public static String strip(String text) {
    if (text == null) {
      return "";
    }
    String result = text;
    int start = result.indexOf(OPEN);
    while (start >= 0) {
      int end = result.indexOf(CLOSE, start + OPEN.length());
      if (end < 0) {
        result = result.substring(0, start);
        break;
      }
      result = result.substring(0, start) + result.substring(end + CLOSE.length());
      start = result.indexOf(OPEN);
    }
    return result;
  }
}
