package com.example.cryptorates.cache;

import com.example.cryptorates.config.CacheProperties;
import com.example.cryptorates.domain.CryptoPair;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 캐시 키 생성
 *
 * 형식: {prefix}:{category}:{segment}[:{segment}]
 * 세그먼트 안의 구분자(':', ',', '%')는 퍼센트 인코딩해서 서로 다른 거래쌍/날짜가 같은 키가 되지 않게 한다.
 */
@Component
@RequiredArgsConstructor
public class CacheKeys {

    static final String RECENT = "recent";
    static final String DAY = "day";
    static final String SNAPSHOT = "snapshot";

    private final CacheProperties cacheProperties;

    public String recent(CryptoPair pair) {
        return join(RECENT, pair.getSymbol());
    }

    public String day(CryptoPair pair, LocalDate date) {
        return join(DAY, pair.getSymbol(), date.toString());
    }

    /**
     * 요청한 거래쌍 조합 단위 스냅샷 키 (순서 무관)
     */
    public String snapshot(Collection<CryptoPair> pairs) {
        String members = EnumSet.copyOf(pairs).stream()
                .map(CryptoPair::getSymbol)
                .map(CacheKeys::escape)
                .collect(Collectors.joining(","));
        return cacheProperties.getKeyPrefix() + ":" + SNAPSHOT + ":" + members;
    }

    /**
     * 해당 거래쌍을 포함하는 모든 스냅샷 키 (거래쌍 집합이 고정이라 부분집합을 모두 열거)
     */
    public List<String> snapshotsContaining(CryptoPair pair) {
        List<CryptoPair> others = new ArrayList<>(EnumSet.complementOf(EnumSet.of(pair)));
        List<String> keys = new ArrayList<>();
        for (int mask = 0; mask < (1 << others.size()); mask++) {
            Set<CryptoPair> members = EnumSet.of(pair);
            for (int i = 0; i < others.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    members.add(others.get(i));
                }
            }
            keys.add(snapshot(members));
        }
        return keys;
    }

    private String join(String category, String... segments) {
        StringBuilder key = new StringBuilder(cacheProperties.getKeyPrefix()).append(':').append(category);
        for (String segment : segments) {
            key.append(':').append(escape(segment));
        }
        return key.toString();
    }

    static String escape(String segment) {
        return segment
                .replace("%", "%25")
                .replace(":", "%3A")
                .replace(",", "%2C");
    }
}
