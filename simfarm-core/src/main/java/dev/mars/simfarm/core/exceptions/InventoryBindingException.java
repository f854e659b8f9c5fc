/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.simfarm.core.exceptions;

/**
 * Thrown when the inventory cannot be bound to host addresses, or when a second
 * binding with a different mock/real selection is attempted in the same run.
 */
public class InventoryBindingException extends SimFarmException {

    public InventoryBindingException(String message) {
        super(message);
    }

    public InventoryBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
