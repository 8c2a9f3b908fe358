package net.certauth.category;

public class TestTags {
  private TestTags() {}

  public static final String CORE = "core";
  public static final String CHAIN = "chain";
  public static final String CLAIMS = "claims";
  public static final String CONFIG = "config";
  public static final String LOGGING = "logging";
}
