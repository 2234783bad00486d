package com.netdesk.ticket.config;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.r2dbc.convert.R2dbcCustomConversions;
import org.springframework.data.r2dbc.dialect.DialectResolver;
import org.springframework.data.r2dbc.dialect.R2dbcDialect;
import org.springframework.r2dbc.core.DatabaseClient;

import com.netdesk.ticket.domain.SenderType;
import com.netdesk.ticket.domain.TicketStatus;

/**
 * Stores enum columns in their lower-case wire form, which is what the other
 * back-office processes read and write.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public R2dbcCustomConversions r2dbcCustomConversions(DatabaseClient databaseClient) {
        R2dbcDialect dialect = DialectResolver.getDialect(databaseClient.getConnectionFactory());
        return R2dbcCustomConversions.of(dialect, List.of(
            new TicketStatusWriter(),
            new TicketStatusReader(),
            new SenderTypeWriter(),
            new SenderTypeReader()
        ));
    }

    @WritingConverter
    static class TicketStatusWriter implements Converter<TicketStatus, String> {
        @Override
        public String convert(TicketStatus source) {
            return source.wireValue();
        }
    }

    @ReadingConverter
    static class TicketStatusReader implements Converter<String, TicketStatus> {
        @Override
        public TicketStatus convert(String source) {
            return TicketStatus.fromValue(source);
        }
    }

    @WritingConverter
    static class SenderTypeWriter implements Converter<SenderType, String> {
        @Override
        public String convert(SenderType source) {
            return source.wireValue();
        }
    }

    @ReadingConverter
    static class SenderTypeReader implements Converter<String, SenderType> {
        @Override
        public SenderType convert(String source) {
            return SenderType.fromValue(source);
        }
    }
}
