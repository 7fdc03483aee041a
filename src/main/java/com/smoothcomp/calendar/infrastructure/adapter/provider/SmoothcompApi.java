package com.smoothcomp.calendar.infrastructure.adapter.provider;

import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Url;

/**
 * Raw page access to smoothcomp.com.
 * Pages are HTML with embedded JSON-LD, so bodies are returned as plain strings.
 */
public interface SmoothcompApi {

    /**
     * Fetches a page by absolute URL or by a path relative to the configured base URL.
     *
     * @param url event page URL or the listing path
     * @return a {@code Call} producing the page body
     */
    @GET
    Call<String> fetchPage(@Url String url);
}
