package com.nft.market.nft_market.config;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import com.nft.market.nft_market.entity.Money;

@Configuration
public class MongoConfig {

    /**
     * Money is stored as its decimal string: amounts may exceed 64 bits.
     */
    @Bean
    MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(new MoneyWriter(), new MoneyReader()));
    }

    @WritingConverter
    static class MoneyWriter implements Converter<Money, String> {
        @Override
        public String convert(Money source) {
            return source.toString();
        }
    }

    @ReadingConverter
    static class MoneyReader implements Converter<String, Money> {
        @Override
        public Money convert(String source) {
            return Money.of(source);
        }
    }
}
