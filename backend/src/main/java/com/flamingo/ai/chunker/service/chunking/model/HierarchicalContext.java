package com.flamingo.ai.chunker.service.chunking.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Breadcrumbs of a chunk exposed as {@code level_1 .. level_n} plus the joined path and depth.
 *
 * @param levels breadcrumb entries, outermost first
 */
public record HierarchicalContext(@JsonIgnore List<String> levels) {

  public static final String PATH_SEPARATOR = " > ";

  public HierarchicalContext {
    levels = List.copyOf(levels);
  }

  @JsonProperty("full_path")
  public String fullPath() {
    return String.join(PATH_SEPARATOR, levels);
  }

  @JsonProperty("depth")
  public int depth() {
    return levels.size();
  }

  @JsonAnyGetter
  public Map<String, String> levelEntries() {
    Map<String, String> entries = new LinkedHashMap<>();
    for (int i = 0; i < levels.size(); i++) {
      entries.put("level_" + (i + 1), levels.get(i));
    }
    return entries;
  }
}
