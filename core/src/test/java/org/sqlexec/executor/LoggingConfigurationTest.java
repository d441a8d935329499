/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.sqlexec.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.sqlexec.planner.physical.pipeline.PipelineDriver;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LoggingConfigurationTest {

  @Test
  void should_keep_engine_loggers_at_info_during_tests() {
    Logger driverLog = LogManager.getLogger(ExecutionDriver.class);
    Logger pipelineLog = LogManager.getLogger(PipelineDriver.class);

    assertEquals(Level.INFO, driverLog.getLevel());
    assertFalse(pipelineLog.isDebugEnabled());
  }
}
