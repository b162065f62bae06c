package com.williamcallahan.boxhunt.service.source;

import com.williamcallahan.boxhunt.model.Candidate;
import com.williamcallahan.boxhunt.types.SourceType;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Anything that can turn a query into image candidates.
 * <p>
 * Implementations never signal an error: failures are logged and surface as an empty list.
 */
public interface SourceClient {

    /**
     * Short, stable name used in logs, source tags and CLI selection
     */
    String name();

    SourceType type();

    /**
     * @param query keyword query, or a seed URL for website sources
     * @param limit maximum number of candidates wanted
     */
    Mono<List<Candidate>> search(String query, int limit);
}
