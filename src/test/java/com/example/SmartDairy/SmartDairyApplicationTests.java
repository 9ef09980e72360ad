package com.example.SmartDairy;

import com.example.SmartDairy.client.CompletionClient;
import com.example.SmartDairy.service.ChatOrchestrator;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(
        properties = {
                "spring.ai.model.chat=none",
                "spring.ai.model.embedding=none",
                "spring.ai.openai.api-key=test",
                "spring.datasource.url=jdbc:h2:mem:testdb;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
                "spring.datasource.driver-class-name=org.h2.Driver",
                "spring.datasource.username=sa",
                "spring.datasource.password=",
                "spring.jpa.hibernate.ddl-auto=create-drop",
                "spring.sql.init.mode=never"
        }
)
@ActiveProfiles("test")
@Import(SmartDairyApplicationTests.TestAiConfiguration.class)
class SmartDairyApplicationTests {

    @Autowired
    private ChatOrchestrator chatOrchestrator;

    @Autowired
    private CompletionClient completionClient;

    @Test
    void contextLoads() {
        assertNotNull(chatOrchestrator);
        assertNotNull(completionClient);
    }

    @TestConfiguration
    static class TestAiConfiguration {
        @Bean
        OpenAiChatModel openAiChatModel() {
            return Mockito.mock(OpenAiChatModel.class);
        }
    }
}
