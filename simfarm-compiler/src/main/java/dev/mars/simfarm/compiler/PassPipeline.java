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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs passes against one compilation context and tracks the stages reached.
 *
 * <p>A pass is only applied when every stage it requires has been reached; otherwise
 * {@link PassOrderException} is thrown before the context is touched. A stage is
 * recorded only after its pass completes without error.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class PassPipeline {

    private static final Logger logger = LoggerFactory.getLogger(PassPipeline.class);

    private final CompilationContext context;
    private final Set<CompilationStage> reached = EnumSet.noneOf(CompilationStage.class);
    private final List<String> executed = new ArrayList<>();

    public PassPipeline(CompilationContext context) {
        this.context = Objects.requireNonNull(context, "Compilation context cannot be null");
    }

    public synchronized void run(Pass pass) throws SimFarmException {
        Set<CompilationStage> missing = EnumSet.noneOf(CompilationStage.class);
        for (CompilationStage required : pass.requires()) {
            if (!reached.contains(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new PassOrderException(pass.name(), missing);
        }
        logger.info("Running pass {}", pass.name());
        long start = System.currentTimeMillis();
        pass.apply(context);
        reached.add(pass.produces());
        executed.add(pass.name());
        logger.debug("Pass {} completed in {}ms", pass.name(), System.currentTimeMillis() - start);
    }

    /**
     * Records a stage reached outside any pass, such as inventory binding.
     */
    public synchronized void markReached(CompilationStage stage) {
        reached.add(stage);
    }

    public synchronized boolean hasRun(CompilationStage stage) {
        return reached.contains(stage);
    }

    public synchronized List<String> getExecutedPasses() {
        return Collections.unmodifiableList(new ArrayList<>(executed));
    }

    public CompilationContext getContext() {
        return context;
    }
}
