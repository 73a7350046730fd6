package edu.jhu.hlt.ptb.util;

import java.io.IOException;
import java.io.Reader;

/**
 * String keyed settings. Getters which take a default return it when the key
 * is missing, and also record it so that dumping the properties shows every
 * value that was actually used.
 */
public class TreebankProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  public TreebankProperties() {
    super();
  }

  /** Alternating keys and values, e.g. from main(String[]) */
  public static TreebankProperties fromArgs(String... keyValues) {
    TreebankProperties p = new TreebankProperties();
    p.putAll(keyValues);
    return p;
  }

  public static TreebankProperties fromReader(Reader r) throws IOException {
    TreebankProperties p = new TreebankProperties();
    p.load(r);
    return p;
  }

  public void putAll(String[] keyValues) {
    putAll(keyValues, false);
  }

  public void putAll(String[] keyValues, boolean allowOverwrites) {
    if (keyValues.length % 2 != 0)
      throw new IllegalArgumentException("need key value pairs, got "
          + keyValues.length + " strings");
    for (int i = 0; i < keyValues.length; i += 2) {
      Object old = put(keyValues[i], keyValues[i + 1]);
      if (!allowOverwrites && old != null) {
        throw new IllegalArgumentException(keyValues[i] + " has two values: "
            + keyValues[i + 1] + " and " + old);
      }
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return parseBoolean(key, value);
  }

  public boolean getBoolean(String key) {
    return parseBoolean(key, getString(key));
  }

  public String getString(String key, String defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue);
      return defaultValue;
    }
    return value;
  }

  public String getString(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new IllegalArgumentException("no value for " + key);
    return value;
  }

  private static boolean parseBoolean(String key, String value) {
    // Boolean.parseBoolean would quietly read a typo as false
    String v = value.trim();
    if ("true".equalsIgnoreCase(v))
      return true;
    if ("false".equalsIgnoreCase(v))
      return false;
    throw new IllegalArgumentException(key + " is not a boolean: " + value);
  }
}
