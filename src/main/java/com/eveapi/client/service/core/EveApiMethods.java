package com.eveapi.client.service.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>EVE API method catalog</h2>
 *
 * <p>Every known EVE XML API method, bound to {@link EveApiMethod#DEFAULT_API_HOST}.
 * Constants are plain data; requests go through
 * {@link com.eveapi.client.service.EveApiClient}.</p>
 *
 * <pre>{@code
 * EveApiResponse rsp = client.send(EveApiMethods.ACCOUNT_CHARACTERS,
 *         Map.of("keyID", 12345, "vCode", "67890"));
 * }</pre>
 *
 * <p>Links: <a href="http://wiki.eve-id.net/APIv2_Page_Index">APIv2 page index</a></p>
 */
public final class EveApiMethods {

    private static final Map<String, EveApiMethod> BY_NAME = new LinkedHashMap<>();

    /* ---------- Account ---------- */

    public static final EveApiMethod ACCOUNT_CHARACTERS = register("ACCOUNT_CHARACTERS", "/account/Characters");
    public static final EveApiMethod ACCOUNT_STATUS = register("ACCOUNT_STATUS", "/account/AccountStatus");

    /* ---------- Character ---------- */

    public static final EveApiMethod CHAR_ACCOUNT_BALANCES = register("CHAR_ACCOUNT_BALANCES", "/char/AccountBalance");
    public static final EveApiMethod CHAR_ASSET_LIST = register("CHAR_ASSET_LIST", "/char/AssetList");
    public static final EveApiMethod CHAR_CALENDAR_EVENT_ATTENDEES = register("CHAR_CALENDAR_EVENT_ATTENDEES", "/char/CalendarEventAttendees");
    public static final EveApiMethod CHAR_CHARACTER_SHEET = register("CHAR_CHARACTER_SHEET", "/char/CharacterSheet");
    public static final EveApiMethod CHAR_CONTACT_LIST = register("CHAR_CONTACT_LIST", "/char/ContactList");
    public static final EveApiMethod CHAR_CONTACT_NOTIFICATIONS = register("CHAR_CONTACT_NOTIFICATIONS", "/char/ContactNotifications");
    public static final EveApiMethod CHAR_CONTRACTS = register("CHAR_CONTRACTS", "/char/Contracts");
    public static final EveApiMethod CHAR_CONTRACT_ITEMS = register("CHAR_CONTRACT_ITEMS", "/char/ContractItems");
    public static final EveApiMethod CHAR_CONTRACT_BIDS = register("CHAR_CONTRACT_BIDS", "/char/ContractBids");
    public static final EveApiMethod CHAR_FACTIONAL_WARFARE_STATS = register("CHAR_FACTIONAL_WARFARE_STATS", "/char/FacWarStats");
    public static final EveApiMethod CHAR_INDUSTRY_JOBS = register("CHAR_INDUSTRY_JOBS", "/char/IndustryJobs");
    public static final EveApiMethod CHAR_KILL_LOG = register("CHAR_KILL_LOG", "/char/Killlog");
    public static final EveApiMethod CHAR_MAIL_BODIES = register("CHAR_MAIL_BODIES", "/char/MailBodies");
    public static final EveApiMethod CHAR_MAILING_LISTS = register("CHAR_MAILING_LISTS", "/char/MailingLists");
    public static final EveApiMethod CHAR_MAIL_MESSAGES = register("CHAR_MAIL_MESSAGES", "/char/MailMessages");
    public static final EveApiMethod CHAR_MARKET_ORDERS = register("CHAR_MARKET_ORDERS", "/char/MarketOrders");
    public static final EveApiMethod CHAR_MEDALS = register("CHAR_MEDALS", "/char/Medals");
    public static final EveApiMethod CHAR_NOTIFICATIONS = register("CHAR_NOTIFICATIONS", "/char/Notifications");
    public static final EveApiMethod CHAR_NOTIFICATION_TEXTS = register("CHAR_NOTIFICATION_TEXTS", "/char/NotificationTexts");
    public static final EveApiMethod CHAR_RESEARCH = register("CHAR_RESEARCH", "/char/Research");
    public static final EveApiMethod CHAR_SKILL_IN_TRAINING = register("CHAR_SKILL_IN_TRAINING", "/char/SkillInTraining");
    public static final EveApiMethod CHAR_SKILL_QUEUE = register("CHAR_SKILL_QUEUE", "/char/SkillQueue");
    public static final EveApiMethod CHAR_STANDINGS = register("CHAR_STANDINGS", "/char/Standings");
    public static final EveApiMethod CHAR_UPCOMING_CALENDAR_EVENTS = register("CHAR_UPCOMING_CALENDAR_EVENTS", "/char/UpcomingCalendarEvents");
    public static final EveApiMethod CHAR_WALLET_JOURNAL = register("CHAR_WALLET_JOURNAL", "/char/WalletJournal");
    public static final EveApiMethod CHAR_WALLET_TRANSACTIONS = register("CHAR_WALLET_TRANSACTIONS", "/char/WalletTransactions");

    /* ---------- Corporation ---------- */

    public static final EveApiMethod CORP_ACCOUNT_BALANCES = register("CORP_ACCOUNT_BALANCES", "/corp/AccountBalance");
    public static final EveApiMethod CORP_ASSET_LIST = register("CORP_ASSET_LIST", "/corp/AssetList");
    public static final EveApiMethod CORP_CONTACT_LIST = register("CORP_CONTACT_LIST", "/corp/ContactList");
    public static final EveApiMethod CORP_CONTAINER_LOG = register("CORP_CONTAINER_LOG", "/corp/ContainerLog");
    public static final EveApiMethod CORP_CONTRACTS = register("CORP_CONTRACTS", "/corp/Contracts");
    public static final EveApiMethod CORP_CONTRACT_ITEMS = register("CORP_CONTRACT_ITEMS", "/corp/ContractItems");
    public static final EveApiMethod CORP_CONTRACT_BIDS = register("CORP_CONTRACT_BIDS", "/corp/ContractBids");
    public static final EveApiMethod CORP_CORPORATION_SHEET = register("CORP_CORPORATION_SHEET", "/corp/CorporationSheet");
    public static final EveApiMethod CORP_FACTIONAL_WARFARE_STATS = register("CORP_FACTIONAL_WARFARE_STATS", "/corp/FacWarStats");
    public static final EveApiMethod CORP_INDUSTRY_JOBS = register("CORP_INDUSTRY_JOBS", "/corp/IndustryJobs");
    public static final EveApiMethod CORP_KILL_LOG = register("CORP_KILL_LOG", "/corp/Killlog");
    public static final EveApiMethod CORP_MARKET_ORDERS = register("CORP_MARKET_ORDERS", "/corp/MarketOrders");
    public static final EveApiMethod CORP_MEDALS = register("CORP_MEDALS", "/corp/Medals");
    public static final EveApiMethod CORP_MEMBER_MEDALS = register("CORP_MEMBER_MEDALS", "/corp/MemberMedals");
    public static final EveApiMethod CORP_MEMBER_SECURITY = register("CORP_MEMBER_SECURITY", "/corp/MemberSecurity");
    public static final EveApiMethod CORP_MEMBER_SECURITY_LOG = register("CORP_MEMBER_SECURITY_LOG", "/corp/MemberSecurityLog");
    public static final EveApiMethod CORP_MEMBER_TRACKING = register("CORP_MEMBER_TRACKING", "/corp/MemberTracking");
    public static final EveApiMethod CORP_OUTPOST_LIST = register("CORP_OUTPOST_LIST", "/corp/OutpostList");
    public static final EveApiMethod CORP_OUTPOST_SERVICE_DETAIL = register("CORP_OUTPOST_SERVICE_DETAIL", "/corp/OutpostServiceDetail");
    public static final EveApiMethod CORP_SHAREHOLDERS = register("CORP_SHAREHOLDERS", "/corp/Shareholders");
    public static final EveApiMethod CORP_STANDINGS = register("CORP_STANDINGS", "/corp/Standings");
    public static final EveApiMethod CORP_STARBASE_DETAILS = register("CORP_STARBASE_DETAILS", "/corp/StarbaseDetail");
    public static final EveApiMethod CORP_STARBASE_LIST = register("CORP_STARBASE_LIST", "/corp/StarbaseList");
    public static final EveApiMethod CORP_TITLES = register("CORP_TITLES", "/corp/Titles");
    public static final EveApiMethod CORP_WALLET_JOURNAL = register("CORP_WALLET_JOURNAL", "/corp/WalletJournal");
    public static final EveApiMethod CORP_WALLET_TRANSACTIONS = register("CORP_WALLET_TRANSACTIONS", "/corp/WalletTransactions");

    /* ---------- EVE universe ---------- */

    public static final EveApiMethod EVE_ALLIANCE_LIST = register("EVE_ALLIANCE_LIST", "/eve/AllianceList");
    public static final EveApiMethod EVE_CERTIFICATE_TREE = register("EVE_CERTIFICATE_TREE", "/eve/CertificateTree");
    public static final EveApiMethod EVE_CHARACTER_ID = register("EVE_CHARACTER_ID", "/eve/CharacterID");
    public static final EveApiMethod EVE_CHARACTER_INFO = register("EVE_CHARACTER_INFO", "/eve/CharacterInfo");
    public static final EveApiMethod EVE_CHARACTER_NAME = register("EVE_CHARACTER_NAME", "/eve/CharacterName");
    public static final EveApiMethod EVE_CONQUERABLE_STATION_LIST = register("EVE_CONQUERABLE_STATION_LIST", "/eve/ConquerableStationList");
    public static final EveApiMethod EVE_ERROR_LIST = register("EVE_ERROR_LIST", "/eve/ErrorList");
    public static final EveApiMethod EVE_FACTIONAL_WARFARE_STATS = register("EVE_FACTIONAL_WARFARE_STATS", "/eve/FacWarStats");
    public static final EveApiMethod EVE_FACTIONAL_WARFARE_TOP_STATS = register("EVE_FACTIONAL_WARFARE_TOP_STATS", "/eve/FacWarTopStats");
    public static final EveApiMethod EVE_REFTYPES_LIST = register("EVE_REFTYPES_LIST", "/eve/RefTypes");
    public static final EveApiMethod EVE_SKILL_TREE = register("EVE_SKILL_TREE", "/eve/SkillTree");

    /* ---------- Map ---------- */

    public static final EveApiMethod MAP_FACTIONAL_WARFARE_SYSTEMS = register("MAP_FACTIONAL_WARFARE_SYSTEMS", "/map/FacWarSystems");
    public static final EveApiMethod MAP_JUMPS = register("MAP_JUMPS", "/map/Jumps");
    public static final EveApiMethod MAP_KILLS = register("MAP_KILLS", "/map/Kills");
    public static final EveApiMethod MAP_SOVEREIGNTY = register("MAP_SOVEREIGNTY", "/map/Sovereignty");

    /* ---------- Server ---------- */

    public static final EveApiMethod SERVER_STATUS = register("SERVER_STATUS", "/server/ServerStatus");

    private EveApiMethods() {
    }

    private static EveApiMethod register(final String name, final String method) {
        EveApiMethod m = new EveApiMethod(method);
        BY_NAME.put(name, m);
        return m;
    }

    /**
     * @return constant name → method, in declaration order
     */
    public static Map<String, EveApiMethod> all() {
        return Collections.unmodifiableMap(BY_NAME);
    }

    /**
     * Looks a method up by its constant name, ignoring case.
     *
     * @param name e.g. {@code SERVER_STATUS} or {@code server_status}
     * @return the method, or empty if the catalog has no such name
     */
    public static Optional<EveApiMethod> byName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.toUpperCase(Locale.ROOT)));
    }
}
