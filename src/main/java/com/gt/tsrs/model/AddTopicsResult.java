package com.gt.tsrs.model;

import java.util.List;

public record AddTopicsResult(List<Topic> added, List<String> skipped) { }
