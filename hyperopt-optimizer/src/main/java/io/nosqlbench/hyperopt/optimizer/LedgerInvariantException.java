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

package io.nosqlbench.hyperopt.optimizer;

/// Thrown when the trial ledgers are found in a state the feed-back logic can
/// never legitimately produce.
///
/// This signals a defect, not a recoverable condition. It is never caught
/// inside the library and the ledgers are left as they were found.
public class LedgerInvariantException extends IllegalStateException {

    public LedgerInvariantException(String message) {
        super(message);
    }
}
