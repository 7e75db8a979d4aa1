package me.golemcore.bridge.adapter.outbound.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatModelFactoryTest {

    private static final String API_KEY = "test-key";

    private BridgeProperties.LlmProperties llm;
    private ChatModelFactory factory;

    @BeforeEach
    void setUp() {
        llm = new BridgeProperties.LlmProperties();
        factory = new ChatModelFactory(llm);
    }

    private void configure(String provider) {
        BridgeProperties.ProviderProperties config = new BridgeProperties.ProviderProperties();
        config.setApiKey(API_KEY);
        llm.getProviders().put(provider, config);
    }

    @Test
    void shouldNotBeConfiguredWithoutApiKey() {
        assertFalse(factory.isConfigured());

        IllegalStateException ex = assertThrows(IllegalStateException.class, factory::create);
        assertTrue(ex.getMessage().contains("bridge.llm.providers.gemini.api-key"));
    }

    @Test
    void shouldTreatBlankApiKeyAsMissing() {
        BridgeProperties.ProviderProperties config = new BridgeProperties.ProviderProperties();
        config.setApiKey("  ");
        llm.getProviders().put("gemini", config);

        assertFalse(factory.isConfigured());
    }

    @Test
    void shouldCreateOpenAiCompatibleModelForGemini() {
        configure("gemini");

        ChatModel model = factory.create();

        assertTrue(factory.isConfigured());
        assertInstanceOf(OpenAiChatModel.class, model);
        assertEquals("gemini-2.0-flash", factory.getModelName());
    }

    @Test
    void shouldCreateAnthropicModel() {
        llm.setProvider("Anthropic");
        llm.setModel("claude-sonnet-4-20250514");
        configure("anthropic");

        assertInstanceOf(AnthropicChatModel.class, factory.create());
    }

    @Test
    void shouldCreateOpenAiModelWithCustomBaseUrl() {
        llm.setProvider("openai");
        llm.setModel("gpt-4o-mini");
        llm.setTemperature(null);
        configure("openai");
        llm.getProviders().get("openai").setBaseUrl("http://localhost:8089/v1");

        assertInstanceOf(OpenAiChatModel.class, factory.create());
    }
}
