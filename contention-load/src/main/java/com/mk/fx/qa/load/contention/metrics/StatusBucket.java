package com.mk.fx.qa.load.contention.metrics;

/** Status-code buckets of the distribution, in report order. */
public enum StatusBucket {
  S200("200"),
  S201("201"),
  S207("207"),
  S400("400"),
  S404("404"),
  S409("409"),
  S422("422"),
  S500("500"),
  S502("502"),
  OTHER("other");

  private final String label;

  StatusBucket(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static StatusBucket of(int statusCode) {
    for (StatusBucket bucket : values()) {
      if (bucket != OTHER && bucket.label.equals(Integer.toString(statusCode))) {
        return bucket;
      }
    }
    return OTHER;
  }

  /** Buckets that count toward the actual error rate. */
  public boolean isError() {
    return this == OTHER || label.charAt(0) == '4' || label.charAt(0) == '5';
  }
}
