/*
 * Copyright (C) 2026 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package okmux.internal.platform;

import java.util.logging.Level;
import java.util.logging.Logger;
import okmux.TransferEngine;

/**
 * Access to platform-specific features. On the JVM this is only logging, routed through {@code
 * java.util.logging} under the {@link TransferEngine} logger name.
 */
public class Platform {
  private static final Platform PLATFORM = new Platform();
  public static final int INFO = 4;
  public static final int WARN = 5;
  private static final Logger logger = Logger.getLogger(TransferEngine.class.getName());

  public static Platform get() {
    return PLATFORM;
  }

  public void log(int level, String message, Throwable t) {
    Level logLevel = level == WARN ? Level.WARNING : Level.INFO;
    logger.log(logLevel, message, t);
  }

  @Override public String toString() {
    return getClass().getSimpleName();
  }
}
