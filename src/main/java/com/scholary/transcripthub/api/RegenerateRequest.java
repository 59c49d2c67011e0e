package com.scholary.transcripthub.api;

/** Optional overrides for a regeneration; absent fields keep the original job's values. */
public record RegenerateRequest(String provider, String language) {}
