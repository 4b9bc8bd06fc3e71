/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.usps;

import java.util.HashMap;
import java.util.Map;

/**
 * Street suffix abbreviations, USPS Publication 28 Appendix C1.
 * Each entry lists the standard abbreviation followed by the primary name and its common variants.
 */
final class StreetSuffixes {

    static final Map<String, String> ENTRIES = build();

    private StreetSuffixes() {
    }

    private static Map<String, String> build() {
        Map<String, String> map = new HashMap<>();
        add(map, "ALY", "ALLEE", "ALLEY", "ALLY");
        add(map, "ANX", "ANEX", "ANNEX", "ANNX");
        add(map, "ARC", "ARCADE");
        add(map, "AVE", "AV", "AVEN", "AVENU", "AVENUE", "AVN", "AVNUE");
        add(map, "BYU", "BAYOO", "BAYOU");
        add(map, "BCH", "BEACH");
        add(map, "BND", "BEND");
        add(map, "BLF", "BLUF", "BLUFF");
        add(map, "BLFS", "BLUFFS");
        add(map, "BTM", "BOT", "BOTTM", "BOTTOM");
        add(map, "BLVD", "BOUL", "BOULEVARD", "BOULV");
        add(map, "BR", "BRNCH", "BRANCH");
        add(map, "BRG", "BRDGE", "BRIDGE");
        add(map, "BRK", "BROOK");
        add(map, "BRKS", "BROOKS");
        add(map, "BG", "BURG");
        add(map, "BGS", "BURGS");
        add(map, "BYP", "BYPA", "BYPAS", "BYPASS", "BYPS");
        add(map, "CP", "CAMP", "CMP");
        add(map, "CYN", "CANYN", "CANYON", "CNYN");
        add(map, "CPE", "CAPE");
        add(map, "CSWY", "CAUSEWAY", "CAUSWA");
        add(map, "CTR", "CEN", "CENT", "CENTER", "CENTR", "CENTRE", "CNTER", "CNTR");
        add(map, "CTRS", "CENTERS");
        add(map, "CIR", "CIRC", "CIRCL", "CIRCLE", "CRCL", "CRCLE");
        add(map, "CIRS", "CIRCLES");
        add(map, "CLF", "CLIFF");
        add(map, "CLFS", "CLIFFS");
        add(map, "CLB", "CLUB");
        add(map, "CMN", "COMMON");
        add(map, "CMNS", "COMMONS");
        add(map, "COR", "CORNER");
        add(map, "CORS", "CORNERS");
        add(map, "CRSE", "COURSE");
        add(map, "CT", "COURT");
        add(map, "CTS", "COURTS");
        add(map, "CV", "COVE");
        add(map, "CVS", "COVES");
        add(map, "CRK", "CREEK");
        add(map, "CRES", "CRESCENT", "CRSENT", "CRSNT");
        add(map, "CRST", "CREST");
        add(map, "XING", "CROSSING", "CRSSNG");
        add(map, "XRD", "CROSSROAD");
        add(map, "XRDS", "CROSSROADS");
        add(map, "CURV", "CURVE");
        add(map, "DL", "DALE");
        add(map, "DM", "DAM");
        add(map, "DV", "DIV", "DIVIDE", "DVD");
        add(map, "DR", "DRIV", "DRIVE", "DRV");
        add(map, "DRS", "DRIVES");
        add(map, "EST", "ESTATE");
        add(map, "ESTS", "ESTATES");
        add(map, "EXPY", "EXP", "EXPR", "EXPRESS", "EXPRESSWAY", "EXPW");
        add(map, "EXT", "EXTENSION", "EXTN", "EXTNSN");
        add(map, "EXTS", "EXTENSIONS");
        add(map, "FALL");
        add(map, "FLS", "FALLS");
        add(map, "FRY", "FERRY", "FRRY");
        add(map, "FLD", "FIELD");
        add(map, "FLDS", "FIELDS");
        add(map, "FLT", "FLAT");
        add(map, "FLTS", "FLATS");
        add(map, "FRD", "FORD");
        add(map, "FRDS", "FORDS");
        add(map, "FRST", "FOREST", "FORESTS");
        add(map, "FRG", "FORG", "FORGE");
        add(map, "FRGS", "FORGES");
        add(map, "FRK", "FORK");
        add(map, "FRKS", "FORKS");
        add(map, "FT", "FORT", "FRT");
        add(map, "FWY", "FREEWAY", "FREEWY", "FRWAY", "FRWY");
        add(map, "GDN", "GARDEN", "GARDN", "GRDEN", "GRDN");
        add(map, "GDNS", "GARDENS", "GRDNS");
        add(map, "GTWY", "GATEWAY", "GATEWY", "GATWAY", "GTWAY");
        add(map, "GLN", "GLEN");
        add(map, "GLNS", "GLENS");
        add(map, "GRN", "GREEN");
        add(map, "GRNS", "GREENS");
        add(map, "GRV", "GROV", "GROVE");
        add(map, "GRVS", "GROVES");
        add(map, "HBR", "HARB", "HARBOR", "HARBR", "HRBOR");
        add(map, "HBRS", "HARBORS");
        add(map, "HVN", "HAVEN");
        add(map, "HTS", "HT", "HEIGHTS");
        add(map, "HWY", "HIGHWAY", "HIGHWY", "HIWAY", "HIWY", "HWAY");
        add(map, "HL", "HILL");
        add(map, "HLS", "HILLS");
        add(map, "HOLW", "HLLW", "HOLLOW", "HOLLOWS", "HOLWS");
        add(map, "INLT", "INLET");
        add(map, "IS", "ISLAND", "ISLND");
        add(map, "ISS", "ISLANDS", "ISLNDS");
        add(map, "ISLE", "ISLES");
        add(map, "JCT", "JCTION", "JCTN", "JUNCTION", "JUNCTN", "JUNCTON");
        add(map, "JCTS", "JCTNS", "JUNCTIONS");
        add(map, "KY", "KEY");
        add(map, "KYS", "KEYS");
        add(map, "KNL", "KNOL", "KNOLL");
        add(map, "KNLS", "KNOLLS");
        add(map, "LK", "LAKE");
        add(map, "LKS", "LAKES");
        add(map, "LAND");
        add(map, "LNDG", "LANDING", "LNDNG");
        add(map, "LN", "LANE");
        add(map, "LGT", "LIGHT");
        add(map, "LGTS", "LIGHTS");
        add(map, "LF", "LOAF");
        add(map, "LCK", "LOCK");
        add(map, "LCKS", "LOCKS");
        add(map, "LDG", "LDGE", "LODG", "LODGE");
        add(map, "LOOP", "LOOPS");
        add(map, "MALL");
        add(map, "MNR", "MANOR");
        add(map, "MNRS", "MANORS");
        add(map, "MDW", "MEADOW");
        add(map, "MDWS", "MEADOWS", "MEDOWS");
        add(map, "MEWS");
        add(map, "ML", "MILL");
        add(map, "MLS", "MILLS");
        add(map, "MSN", "MISSION", "MISSN", "MSSN");
        add(map, "MTWY", "MOTORWAY");
        add(map, "MT", "MNT", "MOUNT");
        add(map, "MTN", "MNTAIN", "MNTN", "MOUNTAIN", "MOUNTIN", "MTIN");
        add(map, "MTNS", "MNTNS", "MOUNTAINS");
        add(map, "NCK", "NECK");
        add(map, "ORCH", "ORCHARD", "ORCHRD");
        add(map, "OVAL", "OVL");
        add(map, "OPAS", "OVERPASS");
        add(map, "PARK", "PRK", "PARKS");
        add(map, "PKWY", "PARKWAY", "PARKWY", "PKWAY", "PKY", "PARKWAYS", "PKWYS");
        add(map, "PASS");
        add(map, "PSGE", "PASSAGE");
        add(map, "PATH", "PATHS");
        add(map, "PIKE", "PIKES");
        add(map, "PNE", "PINE");
        add(map, "PNES", "PINES");
        add(map, "PL", "PLACE");
        add(map, "PLN", "PLAIN");
        add(map, "PLNS", "PLAINS");
        add(map, "PLZ", "PLAZA", "PLZA");
        add(map, "PT", "POINT");
        add(map, "PTS", "POINTS");
        add(map, "PRT", "PORT");
        add(map, "PRTS", "PORTS");
        add(map, "PR", "PRAIRIE", "PRR");
        add(map, "RADL", "RAD", "RADIAL", "RADIEL");
        add(map, "RAMP");
        add(map, "RNCH", "RANCH", "RANCHES", "RNCHS");
        add(map, "RPD", "RAPID");
        add(map, "RPDS", "RAPIDS");
        add(map, "RST", "REST");
        add(map, "RDG", "RDGE", "RIDGE");
        add(map, "RDGS", "RIDGES");
        add(map, "RIV", "RIVER", "RVR", "RIVR");
        add(map, "RD", "ROAD");
        add(map, "RDS", "ROADS");
        add(map, "RTE", "ROUTE");
        add(map, "ROW");
        add(map, "RUE");
        add(map, "RUN");
        add(map, "SHL", "SHOAL");
        add(map, "SHLS", "SHOALS");
        add(map, "SHR", "SHOAR", "SHORE");
        add(map, "SHRS", "SHOARS", "SHORES");
        add(map, "SKWY", "SKYWAY");
        add(map, "SPG", "SPNG", "SPRING", "SPRNG");
        add(map, "SPGS", "SPNGS", "SPRINGS", "SPRNGS");
        add(map, "SPUR", "SPURS");
        add(map, "SQ", "SQR", "SQRE", "SQU", "SQUARE");
        add(map, "SQS", "SQRS", "SQUARES");
        add(map, "STA", "STATION", "STATN", "STN");
        add(map, "STRA", "STRAV", "STRAVEN", "STRAVENUE", "STRAVN", "STRVN", "STRVNUE");
        add(map, "STRM", "STREAM", "STREME");
        add(map, "ST", "STREET", "STRT", "STR");
        add(map, "STS", "STREETS");
        add(map, "SMT", "SUMIT", "SUMITT", "SUMMIT");
        add(map, "TER", "TERR", "TERRACE");
        add(map, "TRWY", "THROUGHWAY");
        add(map, "TRCE", "TRACE", "TRACES");
        add(map, "TRAK", "TRACK", "TRACKS", "TRK", "TRKS");
        add(map, "TRFY", "TRAFFICWAY");
        add(map, "TRL", "TRAIL", "TRAILS", "TRLS");
        add(map, "TRLR", "TRAILER", "TRLRS");
        add(map, "TUNL", "TUNEL", "TUNLS", "TUNNEL", "TUNNELS", "TUNNL");
        add(map, "TPKE", "TRNPK", "TURNPIKE", "TURNPK");
        add(map, "UPAS", "UNDERPASS");
        add(map, "UN", "UNION");
        add(map, "UNS", "UNIONS");
        add(map, "VLY", "VALLEY", "VALLY", "VLLY");
        add(map, "VLYS", "VALLEYS");
        add(map, "VIA", "VDCT", "VIADCT", "VIADUCT");
        add(map, "VW", "VIEW");
        add(map, "VWS", "VIEWS");
        add(map, "VLG", "VILL", "VILLAG", "VILLAGE", "VILLG", "VILLIAGE");
        add(map, "VLGS", "VILLAGES");
        add(map, "VL", "VILLE");
        add(map, "VIS", "VIST", "VISTA", "VST", "VSTA");
        add(map, "WALK", "WALKS");
        add(map, "WALL");
        add(map, "WAY", "WY");
        add(map, "WAYS");
        add(map, "WL", "WELL");
        add(map, "WLS", "WELLS");
        return Map.copyOf(map);
    }

    private static void add(Map<String, String> map, String abbreviation, String... variants) {
        map.put(abbreviation, abbreviation);
        for (String variant : variants) {
            map.put(variant, abbreviation);
        }
    }
}
