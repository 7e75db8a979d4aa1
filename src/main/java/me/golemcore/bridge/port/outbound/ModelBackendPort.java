package me.golemcore.bridge.port.outbound;

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

import me.golemcore.bridge.domain.model.ConversationState;
import me.golemcore.bridge.domain.model.ModelTurn;
import me.golemcore.bridge.domain.model.TranslatedToolSet;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the language model inference service. Provides one generate step
 * with function calling support.
 */
public interface ModelBackendPort {

    /**
     * Generates the next model turn for the conversation so far.
     *
     * <p>
     * The call runs on a worker owned by the backend, never on the caller's
     * thread. Cancelling the returned future abandons the in-flight request on a
     * best-effort basis.
     */
    CompletableFuture<ModelTurn> generate(ConversationState conversation, TranslatedToolSet tools);

    /**
     * Returns the model identifier used for generation.
     */
    String getModel();

    /**
     * Checks if the backend is configured and operational.
     */
    boolean isAvailable();
}
