package com.makemytrade.backtester.bar.cache;

import com.makemytrade.backtester.bar.Timeframe;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

@Data
@AllArgsConstructor
public class BarCacheKey {
    private final String symbol;
    private final Instant start;
    private final Instant end;
    private final Timeframe timeframe;

    /**
     * Stable digest of symbol, range and timeframe, used as the storage key.
     */
    public String hash() {
        String key = symbol + "_" + start.toEpochMilli() + "_" + end.toEpochMilli() + "_" + timeframe.getCode();
        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
    }
}
