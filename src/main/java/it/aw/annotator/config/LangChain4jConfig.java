package it.aw.annotator.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configura i bean LangChain4j.
 *
 * EmbeddingModel:    AllMiniLM-L6-v2 quantizzato, gira in locale senza API key.
 *                    Dimensione fissa (384), quindi i vettori dei chunk restano
 *                    confrontabili fra ingestioni diverse.
 * ChatLanguageModel: OpenAI, usato per citazioni, annotazioni e sintesi.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${llm.openai.api-key}")
    private String apiKey;

    @Value("${llm.openai.model}")
    private String modelName;

    @Value("${llm.openai.timeout-seconds:60}")
    private int timeoutSeconds;

    @Bean
    public EmbeddingModel embeddingModel() {
        log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    @Bean
    public ChatLanguageModel chatLanguageModel() {
        log.info("Inizializzazione ChatLanguageModel: OpenAI {}", modelName);
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(0.2)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
