package de.bycsitsm.agenda.source.caldav;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials and transport settings shared by all CalDAV calendars.
 *
 * @param username             the username for Basic authentication
 * @param password             the password for Basic authentication
 * @param trustAllCertificates whether self-signed server certificates are accepted
 */
@ConfigurationProperties(prefix = "agenda.caldav")
public record CalDavProperties(String username, String password, boolean trustAllCertificates) {

    public CalDavProperties {
        if (username == null) {
            username = "";
        }
        if (password == null) {
            password = "";
        }
    }
}
