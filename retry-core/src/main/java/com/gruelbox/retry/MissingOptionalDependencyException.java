package com.gruelbox.retry;

public class MissingOptionalDependencyException extends RuntimeException {

  public MissingOptionalDependencyException(String groupId, String artifactId) {
    super(
        String.format(
            "Retrying proxies of classes require an additional dependency (%s:%s). Please add it"
                + " to your classpath, or proxy an interface instead.",
            groupId, artifactId));
  }
}
