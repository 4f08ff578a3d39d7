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

package com.vmware.netvirt.nvpdriver.config;

import com.vmware.netvirt.nvpdriver.ControllerConfig;
import com.vmware.netvirt.nvpdriver.NvpDriverConfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Joiner;
import com.google.common.collect.Ordering;
import org.apache.http.HttpHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;
import javax.validation.ValidatorFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the NVP driver configuration from YAML and checks it before any controller is contacted.
 * <p>
 * Besides the bean constraints of {@link NvpDriverConfig}, every controller address must parse as an
 * HTTP host and appear only once.
 */
public class NvpDriverConfigLoader {

  private static final Logger logger = LoggerFactory.getLogger(NvpDriverConfigLoader.class);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

  private NvpDriverConfigLoader() {
  }

  public static NvpDriverConfig load(String configFile) throws BadConfigException {
    return load(Paths.get(configFile));
  }

  /**
   * Parses and checks the configuration file.
   *
   * @throws BadConfigException listing every problem found, or the reason the file could not be read
   */
  public static NvpDriverConfig load(Path configFile) throws BadConfigException {
    NvpDriverConfig config;
    try (InputStream in = Files.newInputStream(configFile)) {
      config = YAML_MAPPER.readValue(in, NvpDriverConfig.class);
    } catch (NoSuchFileException | FileNotFoundException e) {
      throw new BadConfigException("Could not find configuration file: " + configFile);
    } catch (JsonProcessingException e) {
      throw new BadConfigException("Could not parse configuration: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new BadConfigException("Could not read configuration file " + configFile + ": " + e.getMessage(), e);
    }

    if (config == null) {
      throw new BadConfigException("Configuration file is empty: " + configFile);
    }

    check(config);
    logger.info("Loaded NVP driver configuration from {} with {} controller(s)", configFile,
        config.getControllers().size());
    return config;
  }

  /**
   * Checks a configuration built in code the same way a loaded one is checked.
   */
  public static void check(NvpDriverConfig config) throws BadConfigException {
    List<String> errors = new ArrayList<>();
    errors.addAll(checkConstraints(config));
    errors.addAll(checkControllerAddresses(config.getControllers()));

    if (!errors.isEmpty()) {
      throw new BadConfigException("Configuration is not valid:\n\t" + Joiner.on("\n\t").join(errors));
    }
  }

  private static List<String> checkConstraints(NvpDriverConfig config) {
    ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
    try {
      Validator validator = factory.getValidator();
      List<String> errors = new ArrayList<>();
      for (ConstraintViolation<NvpDriverConfig> violation : validator.validate(config)) {
        errors.add(String.format("%s %s (was %s)", violation.getPropertyPath(), violation.getMessage(),
            violation.getInvalidValue()));
      }
      return Ordering.natural().sortedCopy(errors);
    } finally {
      factory.close();
    }
  }

  private static List<String> checkControllerAddresses(List<ControllerConfig> controllers) {
    List<String> errors = new ArrayList<>();
    if (controllers == null) {
      return errors;
    }

    Set<HttpHost> seen = new HashSet<>();
    for (int i = 0; i < controllers.size(); i++) {
      ControllerConfig controller = controllers.get(i);
      if (controller == null || controller.getAddress() == null || controller.getAddress().trim().isEmpty()) {
        continue;
      }

      HttpHost host;
      try {
        host = HttpHost.create(controller.getAddress());
      } catch (IllegalArgumentException e) {
        errors.add(String.format("controllers[%d].address is not a host[:port] or URL (was %s)", i,
            controller.getAddress()));
        continue;
      }

      if (!seen.add(host)) {
        errors.add(String.format("controllers[%d].address names a controller already listed (was %s)", i,
            controller.getAddress()));
      }
    }
    return errors;
  }
}
