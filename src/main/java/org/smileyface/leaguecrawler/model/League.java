package org.smileyface.leaguecrawler.model;

/**
 * A league or cup listed under a country.
 *
 * @param id   last path segment of the league URL
 * @param name display name, also the key of the league in the progress snapshot
 * @param url  canonical league URL
 * @param cup  true when the URL matches the cup keyword pattern
 */
public record League(String id, String name, String url, boolean cup) {
}
