package com.covidamp.api;

/** Lowest policy id carrying a given group number. */
public record GroupRepresentative(long minPolicyId, int groupNumber) {}
