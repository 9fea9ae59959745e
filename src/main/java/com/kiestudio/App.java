package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        Config config = Config.load();
        Database db = new Database(config.dbPath, config.primaryAdminId, config.adminDefaultLimit);
        db.init();

        ModelCatalog catalog = ModelCatalog.loadDefault();
        KieClient kieClient = new KieClient(config);
        if (!kieClient.isConfigured()) {
            log.warn("KIE_API_KEY is not set, generation is disabled");
        }
        if (config.primaryAdminId == 0) {
            log.warn("ADMIN_ID is not set, admin commands are unavailable");
        }

        TextRecognizer recognizer = new TesseractRecognizer(config.tessdataPath);
        if (!recognizer.isAvailable()) {
            log.warn("OCR data not found, payment screenshots will be accepted without verification");
        }
        PaymentVerifier verifier = new PaymentVerifier(recognizer);

        KieStudioBot bot = new KieStudioBot(config);
        MediaFiles files = new TelegramFiles(config, bot::resolveFilePath, kieClient);
        SessionStore sessions = new SessionStore();
        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(4);

        JobOrchestrator orchestrator = new JobOrchestrator(config, db, kieClient, sessions, bot,
                new ResultDelivery(bot), scheduler);
        TopUpFlow topUp = new TopUpFlow(config, db, sessions, verifier, files, bot);
        AdminCommands admin = new AdminCommands(config, db, sessions, verifier, recognizer, files, bot);
        bot.bind(new SessionStateMachine(config, catalog, db, kieClient, sessions, files, bot,
                orchestrator, topUp, admin));

        TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
        botsApi.registerBot(bot);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down, {} generation jobs still tracked", orchestrator.activeJobs().size());
            orchestrator.cancelAll();
            scheduler.shutdownNow();
            bot.shutdown();
        }, "shutdown"));

        log.info("Bot started with {} models", catalog.all().size());
    }
}
