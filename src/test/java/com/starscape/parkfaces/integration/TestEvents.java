package com.starscape.parkfaces.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.parkfaces.features.photos.infra.events.S3Bucket;
import com.starscape.parkfaces.features.photos.infra.events.S3EventDetail;
import com.starscape.parkfaces.features.photos.infra.events.S3EventMessage;
import com.starscape.parkfaces.features.photos.infra.events.S3Object;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.time.Instant;
import java.util.UUID;

/**
 * Builds EventBridge S3 notifications and sends them to SQS.
 */
public final class TestEvents {
    
    private static final ObjectMapper objectMapper = new ObjectMapper();
    
    private TestEvents() {
    }
    
    public static String createS3EventMessage(String detailType, String bucketName, String s3Key, Long size) {
        try {
            S3EventMessage event = new S3EventMessage(
                    UUID.randomUUID().toString(),
                    detailType,
                    "aws.s3",
                    Instant.now().toString(),
                    new S3EventDetail(
                            new S3Bucket(bucketName),
                            new S3Object(s3Key, size, "\"etag\""),
                            "PutObject"
                    )
            );
            return objectMapper.writeValueAsString(event);
        } catch (Exception e) {
            throw new RuntimeException("Failed to create S3 event message", e);
        }
    }
    
    public static void sendS3EventToSqs(SqsClient sqsClient, String queueUrl, String detailType,
                                        String bucketName, String s3Key, Long size) {
        sqsClient.sendMessage(SendMessageRequest.builder()
                .queueUrl(queueUrl)
                .messageBody(createS3EventMessage(detailType, bucketName, s3Key, size))
                .build());
    }
}
