package ae.teletronics.custody.adapters.web;

import ae.teletronics.custody.config.CustodyProperties;
import org.springframework.stereotype.Component;

/**
 * Renders public share URLs as {@code custody.share.base-url} + reference.
 * Example: baseUrl="/s/" -> "/s/{id}"
 *          baseUrl="https://t.me/mybot?start=" -> "https://t.me/mybot?start={id}"
 */
@Component
public class ShareLinkBuilder {

    private final String baseUrl;

    public ShareLinkBuilder(CustodyProperties props) {
        this.baseUrl = props.share().baseUrl().trim();
    }

    /** Works for file ids and legacy share codes alike. */
    public String build(String reference) {
        return baseUrl + reference;
    }
}
