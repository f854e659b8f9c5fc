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

import dev.mars.simfarm.compiler.CompilationContext;
import dev.mars.simfarm.compiler.CompilationStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Writes the topology diagram. A failure here never stops the compilation.
 */
public class RenderDiagramPass extends AbstractPass {

    private static final Logger logger = LoggerFactory.getLogger(RenderDiagramPass.class);

    public RenderDiagramPass() {
        super("render-diagram", CompilationStage.DIAGRAM,
                CompilationStage.ADDRESSES_ASSIGNED, CompilationStage.HOST_MAPPING);
    }

    @Override
    public void apply(CompilationContext context) {
        if (context.getRenderer() == null || context.getDiagramPath() == null) {
            logger.debug("Diagram rendering disabled");
            return;
        }
        try {
            context.getRenderer().render(context.getGraph(), context.getDiagramPath());
            logger.info("Wrote topology diagram to {}", context.getDiagramPath());
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not render topology diagram to {}: {}", context.getDiagramPath(), e.getMessage());
        }
    }
}
