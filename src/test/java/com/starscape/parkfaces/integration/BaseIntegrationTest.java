package com.starscape.parkfaces.integration;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;

import static org.testcontainers.containers.localstack.LocalStackContainer.Service.S3;
import static org.testcontainers.containers.localstack.LocalStackContainer.Service.SQS;

/**
 * Base class for end-to-end tests against real infrastructure.
 * Sets up Testcontainers for PostgreSQL and LocalStack (S3 + SQS).
 * Skipped when no Docker daemon is available.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {
    
    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");
    
    @Container
    public static LocalStackContainer localstack = new LocalStackContainer(
            DockerImageName.parse("localstack/localstack:3.8.1"))
            .withServices(S3, SQS);
    
    protected static final String TEST_BUCKET = "test-bucket";
    protected static final String TEST_QUEUE_NAME = "test-queue";
    
    protected static S3Client s3Client;
    protected static SqsClient sqsClient;
    protected static String queueUrl;
    
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        // Database configuration
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        
        // Photos are read from S3, uploads are announced over SQS
        registry.add("app.storage.type", () -> "s3");
        registry.add("spring.cloud.aws.sqs.enabled", () -> "true");
        
        // AWS configuration for LocalStack
        registry.add("aws.region", () -> localstack.getRegion());
        registry.add("spring.cloud.aws.region.static", () -> localstack.getRegion());
        registry.add("spring.cloud.aws.credentials.access-key", () -> localstack.getAccessKey());
        registry.add("spring.cloud.aws.credentials.secret-key", () -> localstack.getSecretKey());
        registry.add("spring.cloud.aws.sqs.endpoint", () -> localstack.getEndpointOverride(SQS).toString());
        registry.add("aws.s3.bucket", () -> TEST_BUCKET);
        
        AwsBasicCredentials credentials = AwsBasicCredentials.create(
                localstack.getAccessKey(),
                localstack.getSecretKey()
        );
        
        s3Client = S3Client.builder()
                .endpointOverride(localstack.getEndpointOverride(S3))
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(localstack.getRegion()))
                .forcePathStyle(true)
                .build();
        
        sqsClient = SqsClient.builder()
                .endpointOverride(localstack.getEndpointOverride(SQS))
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(localstack.getRegion()))
                .build();
        
        s3Client.createBucket(CreateBucketRequest.builder()
                .bucket(TEST_BUCKET)
                .build());
        
        sqsClient.createQueue(CreateQueueRequest.builder()
                .queueName(TEST_QUEUE_NAME)
                .build());
        queueUrl = sqsClient.getQueueUrl(GetQueueUrlRequest.builder()
                .queueName(TEST_QUEUE_NAME)
                .build()).queueUrl();
        registry.add("aws.sqs.queue-url", () -> queueUrl);
    }
    
    /**
     * Upload a file to LocalStack S3.
     */
    protected void uploadToS3(String key, byte[] content, String contentType) {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(TEST_BUCKET)
                .key(key)
                .contentType(contentType)
                .build();
        
        s3Client.putObject(putRequest, RequestBody.fromBytes(content));
    }
}
