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

package dev.mars.simfarm.compiler;

import dev.mars.simfarm.core.exceptions.SimFarmException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Thrown when a pass runs before the stages it depends on have been reached.
 * This is a programming error in the caller and is never retried.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class PassOrderException extends SimFarmException {

    private final String passName;
    private final Set<CompilationStage> missingStages;

    public PassOrderException(String passName, Set<CompilationStage> missingStages) {
        super(String.format("Pass '%s' requires stages %s which have not run", passName, missingStages));
        this.passName = passName;
        this.missingStages = missingStages.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(missingStages));
    }

    public String getPassName() {
        return passName;
    }

    public Set<CompilationStage> getMissingStages() {
        return missingStages;
    }
}
