package com.cybergrader.modules.content;

public record Note(String name, String body) {}
