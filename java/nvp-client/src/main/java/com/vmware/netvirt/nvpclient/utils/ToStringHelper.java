/*
 * Copyright 2016 VMware, Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License.  You may obtain a copy of
 * the License at http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, without warranties or
 * conditions of any kind, EITHER EXPRESS OR IMPLIED.  See the License for the
 * specific language governing permissions and limitations under the License.
 */

package com.vmware.netvirt.nvpclient.utils;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.lang.reflect.Field;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Renders NVP models using the names they carry on the wire.
 */
public class ToStringHelper {

  private static final Map<Class<?>, ImmutableList<Field>> WIRE_FIELDS = new ConcurrentHashMap<>();

  private ToStringHelper() {
  }

  /**
   * Lists the fields annotated with JsonProperty, labelled by their JSON name.
   * Unset optional fields are left out so that debug logs show what the controller receives.
   */
  public static String jsonObjectToString(Object obj) {
    MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(obj);
    for (Field field : WIRE_FIELDS.computeIfAbsent(obj.getClass(), ToStringHelper::wireFields)) {
      JsonProperty property = field.getAnnotation(JsonProperty.class);
      Object value;
      try {
        value = field.get(obj);
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Cannot read " + field.getName() + " of " + obj.getClass().getSimpleName(), e);
      }

      if (value != null || property.required()) {
        helper.add(Strings.isNullOrEmpty(property.value()) ? field.getName() : property.value(), value);
      }
    }

    return helper.toString();
  }

  private static ImmutableList<Field> wireFields(Class<?> type) {
    ImmutableList.Builder<Field> fields = ImmutableList.builder();
    for (Field field : type.getDeclaredFields()) {
      if (field.isAnnotationPresent(JsonProperty.class)) {
        field.setAccessible(true);
        fields.add(field);
      }
    }
    return fields.build();
  }
}
