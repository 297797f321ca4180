package org.smileyface.leaguecrawler.model;

/**
 * A country entry of the site's left-hand menu.
 *
 * @param id   DOM id of the menu item (e.g. {@code country_6}), used to expand its leagues
 * @param name display name, also the key of the country in the progress snapshot
 * @param url  canonical country URL
 */
public record Country(String id, String name, String url) {
}
