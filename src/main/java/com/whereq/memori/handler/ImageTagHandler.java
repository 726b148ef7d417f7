package com.whereq.memori.handler;

import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.content.NoteSaved;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Suggests tags for an uploaded image with the vision model and stores them
 * as suggestions on the image's memory
 */
@Slf4j
@Component
public class ImageTagHandler extends AbstractLlmHandler {

    static final String TAG_STATUS_SUGGESTED = "suggested";

    @Override
    public JobKind kind() {
        return JobKind.IMAGE_TAG;
    }

    @Override
    public Mono<HandlerResult> handle(QueuedJob job) {
        String memoryId = requirePayload(job, "memory_id");
        String imagePath = requirePayload(job, "image_path");

        log.info("Image tag request | job={} | memory={} | path={}", job.getJobId(), memoryId, imagePath);

        return readImage(imagePath)
            .flatMap(image -> llmClient.completeWithImage(properties.getLlm().getVisionModel(), Prompts.IMAGE_TAG, image))
            .map(LlmResponseParser::extractJson)
            .flatMap(parsed -> {
                List<String> tags = LlmResponseParser.stringList(parsed, "tags");
                String description = LlmResponseParser.optionalString(parsed, "description");
                Mono<Void> stored = tags.isEmpty()
                    ? Mono.empty()
                    : coreApi.addTags(memoryId, tags, TAG_STATUS_SUGGESTED);

                return stored.then(Mono.fromCallable(() -> {
                    log.info("Tagged memory {} with {} tag(s): {}", memoryId, tags.size(), tags);

                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("memory_id", memoryId);
                    result.put("tags", tags);
                    result.put("description", description == null ? "" : description);

                    HandlerResult.HandlerResultBuilder builder = HandlerResult.builder()
                        .result(result)
                        .notification(NoteSaved.builder()
                            .memoryId(memoryId)
                            .suggestedTags(tags)
                            .description(description == null ? "" : description)
                            .build());
                    if (!tags.isEmpty()) {
                        builder.directive(ConversationDirective.awaitButton(anchor(job, memoryId, null, null)));
                    }
                    return builder.build();
                }));
            });
    }

    /**
     * Read and base64-encode the image. A missing file will not appear by
     * retrying, so it is reported as a bad job rather than an I/O outage.
     */
    private Mono<String> readImage(String imagePath) {
        return Mono.fromCallable(() -> Base64.getEncoder().encodeToString(Files.readAllBytes(Path.of(imagePath))))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(NoSuchFileException.class,
                e -> new IllegalArgumentException("Image not found: " + imagePath));
    }
}
