package com.motaz.fraudscan.engine;

import java.util.Map;

import static java.util.Map.entry;

/** Two-letter US state and territory codes to display names. */
public final class StateNames {

    private static final Map<String, String> NAMES = Map.ofEntries(
            entry("AL", "Alabama"), entry("AK", "Alaska"), entry("AZ", "Arizona"), entry("AR", "Arkansas"),
            entry("CA", "California"), entry("CO", "Colorado"), entry("CT", "Connecticut"), entry("DE", "Delaware"),
            entry("FL", "Florida"), entry("GA", "Georgia"), entry("HI", "Hawaii"), entry("ID", "Idaho"),
            entry("IL", "Illinois"), entry("IN", "Indiana"), entry("IA", "Iowa"), entry("KS", "Kansas"),
            entry("KY", "Kentucky"), entry("LA", "Louisiana"), entry("ME", "Maine"), entry("MD", "Maryland"),
            entry("MA", "Massachusetts"), entry("MI", "Michigan"), entry("MN", "Minnesota"), entry("MS", "Mississippi"),
            entry("MO", "Missouri"), entry("MT", "Montana"), entry("NE", "Nebraska"), entry("NV", "Nevada"),
            entry("NH", "New Hampshire"), entry("NJ", "New Jersey"), entry("NM", "New Mexico"), entry("NY", "New York"),
            entry("NC", "North Carolina"), entry("ND", "North Dakota"), entry("OH", "Ohio"), entry("OK", "Oklahoma"),
            entry("OR", "Oregon"), entry("PA", "Pennsylvania"), entry("RI", "Rhode Island"), entry("SC", "South Carolina"),
            entry("SD", "South Dakota"), entry("TN", "Tennessee"), entry("TX", "Texas"), entry("UT", "Utah"),
            entry("VT", "Vermont"), entry("VA", "Virginia"), entry("WA", "Washington"), entry("WV", "West Virginia"),
            entry("WI", "Wisconsin"), entry("WY", "Wyoming"), entry("DC", "District of Columbia"),
            entry("PR", "Puerto Rico"), entry("VI", "Virgin Islands"), entry("GU", "Guam"),
            entry("AS", "American Samoa"), entry("MP", "Northern Mariana Islands"));

    private StateNames() {
    }

    public static String nameOf(String code) {
        if (code == null) {
            return null;
        }
        return NAMES.getOrDefault(code, code);
    }
}
