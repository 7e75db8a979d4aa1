package me.golemcore.bridge.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only log of a single {@code chat()} exchange.
 *
 * <p>
 * Starts as the raw user prompt with no turns. Every tool round appends exactly
 * two turns: the model turn carrying the function calls, followed by a user
 * turn carrying one function result per call, in the same order. Turns are
 * never reordered or removed.
 *
 * <p>
 * Owned by one orchestration run; not safe for concurrent mutation.
 */
public final class ConversationState {

    private final String prompt;
    private final List<Turn> turns = new ArrayList<>();

    public ConversationState(String prompt) {
        this.prompt = prompt != null ? prompt : "";
    }

    public String getPrompt() {
        return prompt;
    }

    /**
     * Read-only view of the appended turns.
     */
    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public int size() {
        return turns.size();
    }

    /**
     * True until the first exchange is appended, i.e. while the next model call
     * should see only the raw prompt.
     */
    public boolean isInitial() {
        return turns.isEmpty();
    }

    /**
     * Appends a model turn and the user turn answering its function calls.
     *
     * @throws IllegalArgumentException
     *             if the results do not pair one-to-one, in order, with the calls
     *             of the model turn
     */
    public void appendToolExchange(Turn modelTurn, List<FunctionResultPart> results) {
        Objects.requireNonNull(modelTurn, "modelTurn");
        Objects.requireNonNull(results, "results");
        if (modelTurn.role() != Turn.Role.MODEL) {
            throw new IllegalArgumentException("Tool exchange must start with a model turn");
        }

        List<FunctionCallPart> calls = modelTurn.functionCalls();
        if (calls.isEmpty()) {
            throw new IllegalArgumentException("Model turn carries no function calls");
        }
        if (calls.size() != results.size()) {
            throw new IllegalArgumentException("Expected " + calls.size() + " function results but got "
                    + results.size());
        }
        for (int i = 0; i < calls.size(); i++) {
            String expected = calls.get(i).name();
            String actual = results.get(i).name();
            if (!Objects.equals(expected, actual)) {
                throw new IllegalArgumentException("Function result #" + (i + 1) + " is for '" + actual
                        + "' but call was '" + expected + "'");
            }
        }

        turns.add(modelTurn);
        turns.add(Turn.user(results));
    }
}
