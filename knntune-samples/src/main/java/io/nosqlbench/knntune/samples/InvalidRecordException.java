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

package io.nosqlbench.knntune.samples;

/// Thrown when a raw input record cannot become a row of a [SampleStore]: a required field is
/// missing, a feature is not a finite number, or the label is empty or not a known class.
public class InvalidRecordException extends RuntimeException {

    private final long rowNumber;
    private final String reason;

    /// @param rowNumber the 1-based position of the record in its input sequence
    /// @param reason why the record was rejected
    public InvalidRecordException(long rowNumber, String reason) {
        this(rowNumber, reason, null);
    }

    public InvalidRecordException(long rowNumber, String reason, Throwable cause) {
        super(String.format("Row %d: %s", rowNumber, reason), cause);
        this.rowNumber = rowNumber;
        this.reason = reason;
    }

    /// @return the 1-based position of the record in its input sequence
    public long getRowNumber() {
        return rowNumber;
    }

    /// @return why the record was rejected
    public String getReason() {
        return reason;
    }
}
