package ae.teletronics.custody.adapters;

import ae.teletronics.custody.adapters.detection.TikaFileTypeDetector;
import ae.teletronics.custody.adapters.time.SystemClockProvider;
import ae.teletronics.custody.adapters.transport.TelegramBlobTransport;
import ae.teletronics.custody.config.CustodyProperties;
import ae.teletronics.custody.ports.BlobTransportPort;
import ae.teletronics.custody.ports.ClockProvider;
import ae.teletronics.custody.ports.FileTypeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@Profile("!test")
public class AdaptersConfig {

    private static final Logger log = LoggerFactory.getLogger(AdaptersConfig.class);

    @Bean
    @ConditionalOnMissingBean(BlobTransportPort.class)
    public BlobTransportPort blobTransport(WebClient.Builder webClientBuilder, CustodyProperties props) {
        CustodyProperties.Transport transport = props.transport();
        if (transport.botToken() == null || transport.botToken().isBlank()) {
            log.warn("custody.transport.bot-token is not set, uploads and remote deletes will fail");
        }
        return new TelegramBlobTransport(webClientBuilder.clone().build(), transport);
    }

    @Bean
    @ConditionalOnMissingBean(FileTypeDetector.class)
    public FileTypeDetector fileTypeDetector() {
        return new TikaFileTypeDetector();
    }

    @Bean
    @ConditionalOnMissingBean(ClockProvider.class)
    public ClockProvider clockProvider() {
        return new SystemClockProvider();
    }
}
