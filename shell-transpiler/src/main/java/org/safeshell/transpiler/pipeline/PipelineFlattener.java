/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.safeshell.transpiler.pipeline;

import java.util.ArrayList;
import java.util.List;
import org.safeshell.transpiler.ast.Command;
import org.safeshell.transpiler.ast.Pipeline;
import org.safeshell.transpiler.ast.PipelineOperator;
import org.safeshell.transpiler.ast.Statement;
import org.safeshell.transpiler.ast.VariableAssignment;
import org.safeshell.transpiler.command.CommandMode;

/**
 * First phase of pipeline compilation: turn a (possibly nested) {@link Pipeline}
 * into one flat list of operands and gap operators.
 *
 * <p>A nested pipeline is inlined when a left-to-right fold of the combined list
 * keeps its meaning: as the first operand, under the same operator, after a
 * {@code ;}, or as a {@code |} chain in a chain without {@code ||}. Anything else,
 * including negated or background sub-pipelines, becomes one self-contained operand.
 */
public class PipelineFlattener {

    private final OperandCompiler operands;

    public PipelineFlattener(OperandCompiler operands) {
        this.operands = operands;
    }

    public FlatPipeline flatten(Statement root, boolean capture) {
        List<Statement> items = new ArrayList<>();
        List<PipelineOperator> operators = new ArrayList<>();
        if (root instanceof Pipeline) {
            Pipeline pipeline = (Pipeline) root;
            collect(pipeline, items, operators, chainHasOr(pipeline));
        } else {
            items.add(root);
        }

        List<PipelinePart> parts = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            boolean pipeInput = i > 0 && operators.get(i - 1) == PipelineOperator.PIPE;
            boolean pipeOutput = i < operators.size() && operators.get(i) == PipelineOperator.PIPE;
            parts.add(part(items.get(i), new CommandMode(pipeInput || pipeOutput, pipeInput, capture)));
        }
        return new FlatPipeline(parts, operators);
    }

    private void collect(Pipeline pipeline, List<Statement> items, List<PipelineOperator> operators, boolean hasOr) {
        List<Statement> commands = pipeline.getCommands();
        for (int i = 0; i < commands.size(); i++) {
            if (i > 0) {
                operators.add(pipeline.getOperator());
            }
            Statement operand = commands.get(i);
            if (operand instanceof Pipeline && inlinable((Pipeline) operand, i, pipeline.getOperator(), hasOr)) {
                collect((Pipeline) operand, items, operators, hasOr);
            } else {
                items.add(operand);
            }
        }
    }

    static boolean inlinable(Pipeline nested, int position, PipelineOperator gap, boolean hasOr) {
        if (nested.isNegated() || nested.isBackground()) {
            return false;
        }
        PipelineOperator operator = nested.getOperator();
        if (operator == PipelineOperator.NONE || nested.getCommands().size() < 2) {
            return true;
        }
        if (operator == PipelineOperator.PIPE) {
            return !hasOr;
        }
        return position == 0 || operator == gap || gap == PipelineOperator.SEQUENCE;
    }

    /** Whether the chain, counting every pipeline that will be inlined into it, contains {@code ||}. */
    static boolean chainHasOr(Pipeline pipeline) {
        if (pipeline.getOperator() == PipelineOperator.OR && pipeline.getCommands().size() > 1) {
            return true;
        }
        for (Statement operand : pipeline.getCommands()) {
            if (operand instanceof Pipeline) {
                Pipeline nested = (Pipeline) operand;
                if (!nested.isNegated() && !nested.isBackground()
                    && nested.getOperator() != PipelineOperator.PIPE && chainHasOr(nested)) {
                    return true;
                }
            }
        }
        return false;
    }

    private PipelinePart part(Statement item, CommandMode mode) {
        if (item instanceof Command) {
            return new PipelinePart(() -> operands.compileCommand((Command) item, mode));
        }
        if (item instanceof VariableAssignment) {
            return new PipelinePart(() -> operands.compileAssignment((VariableAssignment) item));
        }
        if (item instanceof Pipeline) {
            return new PipelinePart(() -> operands.compileNested((Pipeline) item, mode.capture()));
        }
        return new PipelinePart(() -> operands.compileClosure(item));
    }
}
