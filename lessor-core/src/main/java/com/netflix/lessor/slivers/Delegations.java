/*
 * Copyright 2016 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.lessor.slivers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for delegation lists. Substrate models publish delegations as JSON objects that map each delegation
 * identifier to its pool, for example {@code {"primary": {"core": 32, "ram": 384}}}. Label pools may give a
 * single value where a list is expected.
 */
public final class Delegations {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private Delegations() {
    }

    /**
     * Select the delegation to allocate from. Exactly one delegation is used per allocation attempt: the first one.
     *
     * @param delegations delegations of a substrate element
     * @param <T> the pool type
     * @return the first delegation, or null if there are none
     */
    public static <T> Delegation<T> first(List<Delegation<T>> delegations) {
        if (delegations == null || delegations.isEmpty())
            return null;
        return delegations.get(0);
    }

    public static List<Delegation<Capacities>> capacitiesFromJson(String json) throws JsonProcessingException {
        final Map<String, Capacities> map =
                objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Capacities>>() {});
        return toList(map);
    }

    public static List<Delegation<Labels>> labelsFromJson(String json) throws JsonProcessingException {
        final Map<String, Labels> map =
                objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Labels>>() {});
        return toList(map);
    }

    public static <T> String toJson(List<Delegation<T>> delegations) throws JsonProcessingException {
        Map<String, T> map = new LinkedHashMap<>();
        for (Delegation<T> d : delegations)
            map.put(d.getDelegationId(), d.getPool());
        return objectMapper.writeValueAsString(map);
    }

    private static <T> List<Delegation<T>> toList(Map<String, T> map) {
        List<Delegation<T>> result = new ArrayList<>(map.size());
        for (Map.Entry<String, T> entry : map.entrySet())
            result.add(new Delegation<>(entry.getKey(), entry.getValue()));
        return result;
    }
}
