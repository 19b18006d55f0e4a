package com.customertimes.redmine.migration;

import org.apache.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;

/**
 * Settings read from {@code config.xml}. The file is taken from the {@code config.file.path}
 * system property, or from the classpath.
 * <p>
 * Children of {@code <source>}, {@code <target>} and {@code <options>} are flattened into
 * {@code parent-child} parameters, e.g. {@code source-redmine-url}.
 */
public class MigrationConfig {
    private static final Logger logger = Logger.getLogger(MigrationConfig.class);

    public static final String DEFAULT_TIME_ZONE = "Europe/Amsterdam";

    private final Map<String, String> initParams = new HashMap<String, String>();
    private final Map<String, String> userMap = new LinkedHashMap<String, String>();
    private final Map<String, String> trackerMap = new LinkedHashMap<String, String>();
    private final Set<String> closedStatuses = new LinkedHashSet<String>();
    private String rejectedStatus;
    private String rejectedLabel;

    /** Defaults: Bug/Feature/Support trackers, Resolved/Closed/Rejected closed, Rejected labelled wontfix. */
    public MigrationConfig() {
        trackerMap.put("Bug", "bug");
        trackerMap.put("Feature", "enhancement");
        trackerMap.put("Support", "support");
        closedStatuses.add("Resolved");
        closedStatuses.add("Closed");
        closedStatuses.add("Rejected");
        rejectedStatus = "Rejected";
        rejectedLabel = "wontfix";
    }

    public static MigrationConfig load() throws MigrationException {
        String path = System.getProperty("config.file.path");
        InputStream is = null;
        try {
            is = path != null ? new FileInputStream(path)
                    : MigrationConfig.class.getClassLoader().getResourceAsStream("config.xml");
            if (is == null) {
                throw new MigrationException("config.xml not found, set -Dconfig.file.path");
            }
            return parse(is);
        } catch (IOException e) {
            throw new MigrationException("cannot read configuration " + path, e);
        } finally {
            if (is != null) {
                try {
                    is.close();
                } catch (IOException e) {
                    logger.warn("cannot close configuration stream", e);
                }
            }
        }
    }

    public static MigrationConfig parse(InputStream is) throws MigrationException {
        MigrationConfig config = new MigrationConfig();
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document document = builder.parse(is);
            Element root = document.getDocumentElement();
            NodeList nodes = root.getChildNodes();
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                String nodeName = node.getNodeName();
                if (nodeName.equals("source") || nodeName.equals("target") || nodeName.equals("options")) {
                    config.initCommonParams(node);
                } else if (nodeName.equals("users-mapping")) {
                    config.userMap.clear();
                    for (Node user : children(node, "user")) {
                        NamedNodeMap attrs = user.getAttributes();
                        config.userMap.put(attr(attrs, "source"), attr(attrs, "target"));
                    }
                } else if (nodeName.equals("tracker-mapping")) {
                    config.trackerMap.clear();
                    for (Node tracker : children(node, "tracker")) {
                        NamedNodeMap attrs = tracker.getAttributes();
                        config.trackerMap.put(attr(attrs, "source"), attr(attrs, "target"));
                    }
                } else if (nodeName.equals("status-mapping")) {
                    config.closedStatuses.clear();
                    config.rejectedStatus = null;
                    config.rejectedLabel = null;
                    for (Node status : children(node, "status")) {
                        NamedNodeMap attrs = status.getAttributes();
                        String name = attr(attrs, "source");
                        if ("true".equals(attr(attrs, "closed"))) {
                            config.closedStatuses.add(name);
                        }
                        String rejected = attr(attrs, "rejected");
                        if (rejected != null && !rejected.isEmpty()) {
                            config.rejectedStatus = name;
                            config.rejectedLabel = rejected;
                        }
                    }
                }
            }
        } catch (Exception e) {
            throw new MigrationException("cannot parse configuration", e);
        }
        config.logMappings();
        return config;
    }

    private static Iterable<Node> children(Node node, String name) {
        List<Node> result = new ArrayList<Node>();
        NodeList nodes = node.getChildNodes();
        for (int j = 0; j < nodes.getLength(); j++) {
            if (nodes.item(j).getNodeName().equals(name)) {
                result.add(nodes.item(j));
            }
        }
        return result;
    }

    private static String attr(NamedNodeMap attrs, String name) {
        Node item = attrs.getNamedItem(name);
        return item == null ? null : item.getNodeValue();
    }

    private void initCommonParams(Node node) {
        NodeList nodes = node.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node childNode = nodes.item(i);
            if (childNode.getNodeType() == Node.ELEMENT_NODE) {
                initParams.put(node.getNodeName() + "-" + childNode.getNodeName(), childNode.getTextContent().trim());
            }
        }
    }

    private void logMappings() {
        logger.info("------ tracker mapping start ------");
        for (Map.Entry<String, String> entry : trackerMap.entrySet()) {
            logger.info("tracker <" + entry.getKey() + "> will map to label <" + entry.getValue() + ">");
        }
        logger.info("------ tracker mapping end ------");
        logger.info("closed statuses " + closedStatuses + ", rejected status <" + rejectedStatus + "> adds label <"
                + rejectedLabel + ">");
        logger.info("------ users mapping start ------");
        for (Map.Entry<String, String> entry : userMap.entrySet()) {
            logger.info("user <" + entry.getKey() + "> will map to <" + entry.getValue() + ">");
        }
        logger.info("------ users mapping end ------");
    }

    public Map<String, String> getInitParams() {
        return initParams;
    }

    public String get(String key) {
        return initParams.get(key);
    }

    public String get(String key, String defaultValue) {
        String value = initParams.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public void set(String key, String value) {
        initParams.put(key, value);
    }

    public Map<String, String> getUserMap() {
        return Collections.unmodifiableMap(userMap);
    }

    public void mapUser(String redmineName, String giteaUsername) {
        userMap.put(redmineName, giteaUsername);
    }

    public Map<String, String> getTrackerMap() {
        return Collections.unmodifiableMap(trackerMap);
    }

    public Set<String> getClosedStatuses() {
        return Collections.unmodifiableSet(closedStatuses);
    }

    public String getRejectedStatus() {
        return rejectedStatus;
    }

    public String getRejectedLabel() {
        return rejectedLabel;
    }

    public String getRepository() {
        return get("target-repo");
    }

    public Path getRegistryFile() {
        return Paths.get(get("options-registry-file", "migration-registry.json"));
    }

    public Path getProgressFile() {
        return Paths.get(get("options-progress-file", "migration-progress.json"));
    }

    public Path getPendingReferencesFile() {
        return Paths.get(get("options-pending-references-file", "pending-references.json"));
    }

    public String getFallbackUsername() {
        return get("options-fallback-username", "");
    }

    public boolean isDeriveUsernames() {
        return Boolean.parseBoolean(get("options-derive-usernames", "false"));
    }

    public TimeZone getTimeZone() {
        return TimeZone.getTimeZone(get("options-time-zone", DEFAULT_TIME_ZONE));
    }

    public String getDateFormat() {
        return get("options-date-format", JournalRenderer.DEFAULT_DATE_FORMAT);
    }

    public int getLabelMaxAttempts() {
        return Integer.parseInt(get("options-label-max-attempts", "10"));
    }

    public long getLabelRetryIntervalMillis() {
        return Long.parseLong(get("options-label-retry-interval", "500"));
    }

    public long getLabelMaxIntervalMillis() {
        return Long.parseLong(get("options-label-max-interval", "8000"));
    }

    /** Zero means no limit. */
    public long getRunTimeoutMinutes() {
        return Long.parseLong(get("options-run-timeout-minutes", "0"));
    }

    public boolean isSkipEmptyJournals() {
        return Boolean.parseBoolean(get("options-skip-empty-journals", "false"));
    }

    public int getPageSize() {
        return Integer.parseInt(get("source-page-size", "100"));
    }
}
