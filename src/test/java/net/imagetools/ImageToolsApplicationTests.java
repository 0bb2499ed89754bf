package net.imagetools;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.awt.Color;
import java.util.Optional;
import net.imagetools.domain.operation.RotateOperation;
import net.imagetools.model.Image;
import net.imagetools.service.ImageEditingService;
import net.imagetools.service.session.SessionLifecycleService;
import net.imagetools.service.storage.LocalDiskRevisionStore;
import net.imagetools.service.storage.RevisionStore;
import net.imagetools.testutil.TestImages;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Context load test
 *
 * Features:
 * - Verifies the application context starts without S3 credentials
 * - Ensures the local disk store is selected as the fallback backend
 * - Runs one upload and edit through the wired beans as a smoke test
 * - Parses an assistant reply with the auto-configured Jackson mapper
 */
@SpringBootTest(properties = {
    "imagetools.storage.root=target/test-storage/${random.uuid}",
    "imagetools.session.sweep-on-startup=false",
    "imagetools.storage.gc-enabled=false",
    "s3.access-key-id=",
    "s3.secret-access-key=",
    "s3.bucket-name="
})
class ImageToolsApplicationTests {

    @Autowired
    private RevisionStore revisionStore;

    @Autowired
    private SessionLifecycleService sessionLifecycleService;

    @Autowired
    private ImageEditingService imageEditingService;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    @Qualifier("taskScheduler")
    private TaskScheduler taskScheduler;

    @Test
    void contextLoadsWithLocalDiskStore() {
        assertInstanceOf(LocalDiskRevisionStore.class, revisionStore);
        ThreadPoolTaskScheduler scheduler = assertInstanceOf(ThreadPoolTaskScheduler.class, taskScheduler);
        assertEquals("ImageToolsScheduler-", scheduler.getThreadNamePrefix());
    }

    @Test
    void uploadAndEditThroughWiredBeans() {
        String sessionId = sessionLifecycleService.createSession().id();
        Image image = imageEditingService.upload(sessionId, "smoke.png", TestImages.png(16, 8, Color.GREEN));

        Image rotated = imageEditingService.applyOperation(image.id(), new RotateOperation(90));

        assertEquals(1L, rotated.currentSequence());
        assertEquals(8, rotated.width());
        assertEquals(16, rotated.height());
    }

    @Test
    void applyAssistantReplyThroughWiredBeans() {
        assertNotNull(objectMapper);
        String sessionId = sessionLifecycleService.createSession().id();
        Image image = imageEditingService.upload(sessionId, "reply.png", TestImages.png(16, 8, Color.BLUE));

        Optional<Image> edited = imageEditingService.applyAiResponse(image.id(),
            "Done.\n```json\n{\"operations\": [{\"type\": \"grayscale\"}]}\n```");

        assertTrue(edited.isPresent());
        assertEquals(1L, edited.get().currentSequence());
    }
}
