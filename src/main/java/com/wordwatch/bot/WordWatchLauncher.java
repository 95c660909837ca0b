package com.wordwatch.bot;

import com.wordwatch.bot.config.MonitorConfig;
import com.wordwatch.bot.ledger.LedgerException;
import com.wordwatch.bot.listener.MessageModerationListener;
import com.wordwatch.bot.service.DecisionExecutor;
import com.wordwatch.bot.service.ModerationOrchestrator;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class WordWatchLauncher {
    private static final Logger log = LoggerFactory.getLogger(WordWatchLauncher.class);
    private static final Duration MAINTENANCE_PERIOD = Duration.ofHours(1);

    private WordWatchLauncher() {
    }

    public static void main(String[] args) throws InterruptedException {
        MonitorConfig config;
        String token;
        try {
            config = MonitorConfig.fromEnvironment();
            token = config.requireDiscordToken();
        } catch (IllegalStateException error) {
            log.error("Bot configuration error: {}", error.getMessage());
            log.error("Set DISCORD_TOKEN and fix the listed value before launching the bot.");
            return;
        }

        ModerationOrchestrator orchestrator;
        try {
            orchestrator = ModerationOrchestrator.fromConfig(config, Clock.systemDefaultZone());
        } catch (LedgerException error) {
            log.error("Cannot open violation ledger at {}", config.databasePath(), error);
            return;
        }
        orchestrator.startMaintenance(MAINTENANCE_PERIOD);
        DecisionExecutor executor = new DecisionExecutor(
                config.deleteEnabled(),
                config.exemptRoles(),
                orchestrator.statistics()
        );

        JDA jda = JDABuilder.createDefault(token)
                .enableIntents(List.of(
                        GatewayIntent.GUILD_MESSAGES,
                        GatewayIntent.MESSAGE_CONTENT,
                        GatewayIntent.GUILD_MEMBERS
                ))
                .setMemberCachePolicy(MemberCachePolicy.ONLINE)
                .addEventListeners(new MessageModerationListener(config, orchestrator, executor))
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            jda.shutdown();
            orchestrator.close();
        }, "wordwatch-shutdown"));

        jda.awaitReady();
        MonitorConfig.BanRules rules = config.banRules();
        log.info("wordwatch ready: {} forbidden word(s), ladder {}s/{}s/{}s, reset at {}:00, retention {} day(s)",
                orchestrator.keywords().size(),
                rules.firstBanSeconds(),
                rules.secondBanSeconds(),
                rules.thirdBanSeconds(),
                rules.resetHour(),
                rules.retentionDays());
    }
}
