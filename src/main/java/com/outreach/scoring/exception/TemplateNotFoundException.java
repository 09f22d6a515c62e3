package com.outreach.scoring.exception;

public class TemplateNotFoundException extends RuntimeException {

    private final String name;

    public TemplateNotFoundException(String name) {
        super("Template not found: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
