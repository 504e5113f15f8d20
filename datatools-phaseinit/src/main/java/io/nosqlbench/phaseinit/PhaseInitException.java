package io.nosqlbench.phaseinit;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Base type for every failure raised while computing a null initializer estimate.
///
/// All failures are unchecked. Nothing is retried internally, and no partial
/// estimate is ever returned alongside one of these.
public class PhaseInitException extends RuntimeException {

    public PhaseInitException(String message) {
        super(message);
    }

    public PhaseInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
