package com.socialfusion.admin.adapter.out;

import com.socialfusion.admin.application.port.out.CacheAdminPort;
import com.socialfusion.application.port.out.ExpiringCache;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class CacheAdminAdapter implements CacheAdminPort {

    private final List<ExpiringCache<?, ?>> caches;

    public CacheAdminAdapter(List<ExpiringCache<?, ?>> caches) {
        this.caches = caches;
    }

    @Override
    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new TreeMap<>();
        for (ExpiringCache<?, ?> cache : caches) {
            sizes.put(cache.name(), cache.size());
        }
        return sizes;
    }

    @Override
    public Map<String, Integer> clearAll() {
        Map<String, Integer> cleared = new TreeMap<>();
        for (ExpiringCache<?, ?> cache : caches) {
            cleared.put(cache.name(), cache.invalidateAll());
        }
        return cleared;
    }
}
