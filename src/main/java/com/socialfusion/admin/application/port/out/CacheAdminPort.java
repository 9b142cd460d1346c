package com.socialfusion.admin.application.port.out;

import java.util.Map;

/**
 * Port for admin operations across the in-process caches.
 * Keeps the admin module from depending on individual cache beans.
 */
public interface CacheAdminPort {

    /**
     * Live entry count per cache name.
     */
    Map<String, Integer> sizes();

    /**
     * Empties every cache.
     *
     * @return entries removed per cache name
     */
    Map<String, Integer> clearAll();
}
