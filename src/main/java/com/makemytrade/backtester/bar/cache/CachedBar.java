package com.makemytrade.backtester.bar.cache;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.bar.Timeframe;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

@Builder
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Table("cached_bars")
public class CachedBar {
    @Id
    @Column("id")
    private Long id;

    @Column("cache_key")
    private String cacheKey;

    @Column("symbol")
    private String symbol;

    @Column("timeframe")
    private String timeframe;

    @Column("bar_time")
    private long barTime;

    @Column("open_price")
    private double open;

    @Column("high_price")
    private double high;

    @Column("low_price")
    private double low;

    @Column("close_price")
    private double close;

    @Column("volume")
    private double volume;

    public static CachedBar from(String cacheKey, Bar bar) {
        return CachedBar.builder()
                .cacheKey(cacheKey)
                .symbol(bar.getSymbol())
                .timeframe(bar.getTimeframe().getCode())
                .barTime(bar.getTimestamp().toEpochMilli())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .build();
    }

    public Bar toBar() {
        return Bar.builder()
                .symbol(symbol)
                .timeframe(Timeframe.fromCode(timeframe))
                .timestamp(Instant.ofEpochMilli(barTime))
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }
}
