package com.customertimes.redmine.migration;

import org.apache.commons.codec.binary.Base64;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpEntityEnclosingRequestBase;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPatch;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.util.EntityUtils;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Plain HTTP plumbing shared by the Redmine and Gitea clients. Requests are tagged with the
 * instance they go to ({@code "source"} or {@code "target"}) so the right credentials are sent.
 */
public class MigrationServiceConnector {
    private static final Logger logger = Logger.getLogger(MigrationServiceConnector.class);

    public static final String SOURCE = "source";
    public static final String TARGET = "target";

    static class Response {
        final int statusCode;
        final String body;

        Response(int statusCode, String body) {
            this.statusCode = statusCode;
            this.body = body;
        }

        boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }

    private final HttpClient httpclient;
    private final Map<String, String> initParams;

    public MigrationServiceConnector(Map<String, String> initParams) {
        this(HttpClientBuilder.create().useSystemProperties().build(), initParams);
    }

    public MigrationServiceConnector(HttpClient httpclient, Map<String, String> initParams) {
        this.httpclient = httpclient;
        this.initParams = initParams;
    }

    Response get(String instance, String url) throws IOException {
        HttpGet httpget = new HttpGet(url);
        return execute(instance, httpget);
    }

    Response postJson(String instance, String url, String json) throws IOException {
        HttpPost httppost = new HttpPost(url);
        return execute(instance, withJson(httppost, json));
    }

    Response patchJson(String instance, String url, String json) throws IOException {
        HttpPatch httppatch = new HttpPatch(url);
        return execute(instance, withJson(httppatch, json));
    }

    private static HttpRequestBase withJson(HttpEntityEnclosingRequestBase request, String json) {
        request.setEntity(new StringEntity(json, ContentType.APPLICATION_JSON));
        return request;
    }

    private Response execute(String instance, HttpRequestBase request) throws IOException {
        authorize(instance, request);
        request.setHeader("Accept", "application/json");
        logger.debug(request.getMethod() + " " + request.getURI());
        HttpResponse response = httpclient.execute(request);
        try {
            HttpEntity entity = response.getEntity();
            String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            int statusCode = response.getStatusLine().getStatusCode();
            if (statusCode >= 300) {
                logger.info("rest http " + request.getMethod() + " error " + statusCode + " for " + request.getURI());
            }
            return new Response(statusCode, body);
        } finally {
            EntityUtils.consumeQuietly(response.getEntity());
        }
    }

    private void authorize(String instance, HttpRequestBase request) {
        if (SOURCE.equals(instance)) {
            String apiKey = initParams.get("source-api-key");
            if (apiKey != null && !apiKey.isEmpty()) {
                request.setHeader("X-Redmine-API-Key", apiKey);
            }
            return;
        }
        String token = initParams.get(instance + "-api-token");
        if (token != null && !token.isEmpty()) {
            request.setHeader("Authorization", "token " + token);
            return;
        }
        String username = initParams.get(instance + "-username");
        if (username != null && !username.isEmpty()) {
            String auth = username + ":" + initParams.get(instance + "-password");
            byte[] encodedAuth = Base64.encodeBase64(auth.getBytes(StandardCharsets.UTF_8));
            request.setHeader("Authorization", "Basic " + new String(encodedAuth, StandardCharsets.US_ASCII));
        }
    }
}
