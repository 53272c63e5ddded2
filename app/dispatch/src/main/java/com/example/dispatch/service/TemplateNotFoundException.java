package com.example.dispatch.service;

public class TemplateNotFoundException extends IllegalArgumentException {

  public TemplateNotFoundException(String templateId) {
    super("template not found templateId=" + templateId);
  }
}
