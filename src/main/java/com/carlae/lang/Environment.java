package com.carlae.lang;

import java.util.HashMap;
import java.util.Map;

public class Environment {
  private final Map<String, Object> values = new HashMap<>();
  final Environment enclosing;

  public Environment() {
      enclosing = null;
  }

  public Environment(Environment enclosing) {
      this.enclosing = enclosing;
  }

  public Environment getEnclosing() {
      return enclosing;
  }

  // always binds in this frame, shadowing any outer binding of the same name
  public void define(String name, Object value) {
      values.put(name, value);
  }

  public Object get(String name) {
      return get(name, null);
  }

  // presence is decided by containsKey, never by the bound value, so names
  // bound to 0 or to the empty list resolve like any other
  public Object get(String name, Token errTok) {
      Environment env = this;
      while (env != null) {
          if (env.values.containsKey(name)) {
              return env.values.get(name);
          }
          env = env.enclosing;
      }
      throw new CarlaeNameError(errTok, name);
  }

  public boolean isDefined(String name) {
      Environment env = this;
      while (env != null) {
          if (env.values.containsKey(name)) {
              return true;
          }
          env = env.enclosing;
      }
      return false;
  }

  // bound in this frame itself, ignoring enclosing frames
  public boolean isDefinedLocally(String name) {
      return values.containsKey(name);
  }

  public Environment getGlobal() {
      Environment env = this;
      while (env.enclosing != null) {
          env = env.enclosing;
      }
      return env;
  }

}
