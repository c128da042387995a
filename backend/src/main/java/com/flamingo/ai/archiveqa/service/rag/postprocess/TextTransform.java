package com.flamingo.ai.archiveqa.service.rag.postprocess;

import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/** A named, side-effect free rewrite step applied to answer text. */
public interface TextTransform {

  String name();

  String apply(String text);

  static TextTransform of(String name, UnaryOperator<String> operation) {
    return new TextTransform() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public String apply(String text) {
        return operation.apply(text);
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  /** Replaces every match of {@code pattern}; {@code replacement} may use group references. */
  static TextTransform replaceAll(String name, Pattern pattern, String replacement) {
    return of(name, text -> pattern.matcher(text).replaceAll(replacement));
  }
}
