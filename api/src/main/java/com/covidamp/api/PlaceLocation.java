package com.covidamp.api;

/** Location fields of a place that has had at least one matching policy. */
public record PlaceLocation(String iso3, String area1, String ansiFips, String level) {}
