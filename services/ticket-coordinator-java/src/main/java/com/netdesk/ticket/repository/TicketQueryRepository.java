package com.netdesk.ticket.repository;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.dialect.Escaper;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.netdesk.ticket.domain.Ticket;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Paginated ticket listing with optional filters. Derived queries cannot express
 * "filter only when present", so the criteria are assembled here.
 */
@Repository
public class TicketQueryRepository {

    private final R2dbcEntityTemplate template;

    public TicketQueryRepository(R2dbcEntityTemplate template) {
        this.template = template;
    }

    public Flux<Ticket> findPage(TicketFilter filter, TicketView view, int page, int size) {
        Query query = Query.query(criteria(filter))
            .sort(view.sort())
            .limit(size)
            .offset((long) page * size);
        return template.select(Ticket.class)
            .matching(query)
            .all();
    }

    public Mono<Long> count(TicketFilter filter) {
        return template.count(Query.query(criteria(filter)), Ticket.class);
    }

    private Criteria criteria(TicketFilter filter) {
        Criteria criteria = Criteria.empty();
        if (filter.status() != null) {
            criteria = criteria.and("status").is(filter.status().wireValue());
        }
        if (filter.clientId() != null) {
            criteria = criteria.and("clientId").is(filter.clientId());
        }
        if (StringUtils.hasText(filter.search())) {
            String pattern = containsPattern(filter.search());
            criteria = criteria.and(
                Criteria.where("subject").like(pattern).ignoreCase(true)
                    .or("description").like(pattern).ignoreCase(true)
            );
        }
        return criteria;
    }

    /**
     * LIKE pattern matching the text anywhere; wildcards typed by the user match literally.
     */
    static String containsPattern(String search) {
        return "%" + Escaper.DEFAULT.escape(search.trim()) + "%";
    }
}
