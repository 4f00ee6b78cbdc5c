package com.metering.fetch.support;

import com.metering.fetch.exception.UpstreamException;
import com.metering.fetch.upstream.PageQuery;
import com.metering.fetch.upstream.UpstreamClient;
import com.metering.fetch.upstream.UpstreamPage;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Upstream stand-in that replays scripted pages or failures in order, then falls back
 * to a default responder. Every query it receives is recorded.
 */
public class ScriptedUpstreamClient implements UpstreamClient {

    private final Deque<Function<PageQuery, UpstreamPage>> script = new ConcurrentLinkedDeque<>();
    private final List<PageQuery> queries = new CopyOnWriteArrayList<>();
    private volatile Function<PageQuery, UpstreamPage> fallback = ScriptedUpstreamClient::singlePageFor;

    @Override
    public UpstreamPage fetchPage(PageQuery query) {
        queries.add(query);
        Function<PageQuery, UpstreamPage> next = script.poll();
        return (next != null ? next : fallback).apply(query);
    }

    public ScriptedUpstreamClient thenReturn(UpstreamPage page) {
        script.add(query -> page);
        return this;
    }

    public ScriptedUpstreamClient thenFail(UpstreamException error) {
        script.add(query -> {
            throw error;
        });
        return this;
    }

    public ScriptedUpstreamClient thenRespond(Function<PageQuery, UpstreamPage> responder) {
        script.add(responder);
        return this;
    }

    public void always(Function<PageQuery, UpstreamPage> responder) {
        this.fallback = responder;
    }

    public void alwaysFail(UpstreamException error) {
        this.fallback = query -> {
            throw error;
        };
    }

    public List<PageQuery> queries() {
        return new ArrayList<>(queries);
    }

    public int callCount() {
        return queries.size();
    }

    public void reset() {
        script.clear();
        queries.clear();
        fallback = ScriptedUpstreamClient::singlePageFor;
    }

    /** One final page holding two samples for every requested point. */
    public static UpstreamPage singlePageFor(PageQuery query) {
        List<UpstreamPage.UpstreamSample> samples = new ArrayList<>();
        for (String point : query.pointNames()) {
            samples.add(new UpstreamPage.UpstreamSample(point, query.start().toString(), 1.0));
            samples.add(new UpstreamPage.UpstreamSample(point, query.start().plusSeconds(900).toString(), 2.0));
        }
        return new UpstreamPage(samples, null, false);
    }

    public static UpstreamPage page(String nextCursor, boolean hasMore, UpstreamPage.UpstreamSample... samples) {
        return new UpstreamPage(List.of(samples), nextCursor, hasMore);
    }

    public static UpstreamPage.UpstreamSample sample(String name, String time, double value) {
        return new UpstreamPage.UpstreamSample(name, time, value);
    }
}
