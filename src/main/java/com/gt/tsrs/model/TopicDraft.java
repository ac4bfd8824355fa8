package com.gt.tsrs.model;

// A topic name and description supplied by a caller, e.g. topics extracted from a syllabus
public record TopicDraft(String name, String description) { }
