/*
 * Where: Dispatch application configuration binding
 * What: Holds message templates keyed by template id
 * Why: Let operators edit wording without redeploying callers
 */
package com.example.dispatch.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.templating")
public record TemplateProperties(Map<String, Template> templates) {

  public TemplateProperties {
    templates = templates == null ? Map.of() : Map.copyOf(templates);
  }

  public record Template(String title, String body) {}
}
