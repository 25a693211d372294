package com.cybergrader.exception;

import lombok.Getter;

import java.util.Locale;

@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final String id;

    public ResourceNotFoundException(String resource, String id) {
        super("Unknown " + resource.toLowerCase(Locale.ROOT) + ": " + id);
        this.resource = resource;
        this.id = id;
    }
}
