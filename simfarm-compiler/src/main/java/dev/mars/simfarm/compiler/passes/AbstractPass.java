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

package dev.mars.simfarm.compiler.passes;

import dev.mars.simfarm.compiler.CompilationStage;
import dev.mars.simfarm.compiler.Pass;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Holds the name and stage bookkeeping shared by the built-in passes.
 */
public abstract class AbstractPass implements Pass {

    private final String name;
    private final CompilationStage produces;
    private final Set<CompilationStage> requires;

    protected AbstractPass(String name, CompilationStage produces, CompilationStage... requires) {
        this.name = name;
        this.produces = produces;
        EnumSet<CompilationStage> required = EnumSet.noneOf(CompilationStage.class);
        Collections.addAll(required, requires);
        this.requires = Collections.unmodifiableSet(required);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompilationStage produces() {
        return produces;
    }

    @Override
    public Set<CompilationStage> requires() {
        return requires;
    }

    @Override
    public String toString() {
        return name;
    }
}
