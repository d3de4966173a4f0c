package dev.postify;

import dev.postify.approval.ApprovalChannel;
import dev.postify.config.RotationProperties;
import dev.postify.exception.ConfigurationException;
import dev.postify.publish.PublisherRegistry;
import dev.postify.rewrite.DraftRewriter;
import dev.postify.service.LedgerService;
import dev.postify.service.TemplateCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class PostifyApplication implements CommandLineRunner {

    private static final String SEPARATOR = "========================================";

    private final TemplateCatalog templateCatalog;
    private final RotationProperties rotationProperties;
    private final PublisherRegistry publisherRegistry;
    private final ApprovalChannel approvalChannel;
    private final DraftRewriter draftRewriter;
    private final LedgerService ledgerService;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(PostifyApplication.class, args);
    }

    @Override
    public void run(String... args) {
        log.info(SEPARATOR);
        log.info("Postify Rotation Starting");
        log.info(SEPARATOR);

        try {
            templateCatalog.requireNonEmpty();
        } catch (ConfigurationException e) {
            log.error("Startup aborted: {}", e.getMessage());
            exitManager.exit(1);
            return;
        }

        log.info("Zone: {}, slots: {}, posts per slot: {}", rotationProperties.getZone(),
                rotationProperties.getSlots(), rotationProperties.getPostsPerSlot());
        log.info("Dry run mode: {}", rotationProperties.isDryRun());
        log.info("Templates: {}", templateCatalog.all().size());
        log.info("Publishers: {}", publisherRegistry.platforms());
        log.info("Approval channel: {}, AI rewrite: {}", approvalChannel.getName(), draftRewriter.isAiBacked());
        log.info("Ledger entries: {}", ledgerService.getTotalPublished());
        log.info(SEPARATOR);
    }
}
