/*
 * Copyright 2025 The Effectful Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.effectful.rewrite;

/**
 * Thrown when type information that the rewrite needs is not available yet, typically because the
 * host is still inferring the type of an enclosing expression. The {@link RewriteDriver} responds
 * by returning the original tree unchanged; this is never reported to the user.
 */
final class InferenceUnavailable extends RuntimeException {
  InferenceUnavailable(String msg) {
    super(msg, null, false, false);
  }

  InferenceUnavailable(String msg, Throwable cause) {
    super(msg, cause, false, false);
  }
}
