package com.gt.subjunctive.model;

import java.util.List;

// Per-request practice state, passed explicitly so concurrent users never share it
public record PracticeContext(String userId, boolean adaptive, List<String> dueVerbs) { }
