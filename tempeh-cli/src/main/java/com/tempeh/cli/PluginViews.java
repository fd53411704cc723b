package com.tempeh.cli;

import com.tempeh.plugin.Capability;
import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.audit.AuditFinding;
import com.tempeh.plugin.audit.AuditResult;
import com.tempeh.plugin.manager.ManagedPlugin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Plain maps of plugin records for JSON output and text rendering. */
final class PluginViews {

    private PluginViews() {
    }

    static Map<String, Object> summary(ManagedPlugin record) {
        Map<String, Object> view = new LinkedHashMap<>();
        PluginDescriptor d = record.getDescriptor();
        view.put("id", record.getId());
        view.put("version", d != null ? d.getVersion().toString() : null);
        view.put("state", record.getState().name());
        view.put("source", record.getSource() != null ? record.getSource().toString() : null);
        if (d != null) {
            view.put("author", d.getAuthor());
            view.put("capabilities", capabilityKeys(d));
            view.put("keywords", new ArrayList<>(d.getKeywords()));
        }
        if (record.getFailure() != null) {
            view.put("error", record.getFailure().getMessage());
        }
        return view;
    }

    static Map<String, Object> detail(ManagedPlugin record) {
        Map<String, Object> view = summary(record);
        PluginDescriptor d = record.getDescriptor();
        if (d != null) {
            view.put("name", d.getName());
            view.put("description", d.getDescription());
            view.put("license", d.getLicense());
            view.put("entryPoint", d.getEntryPoint());
            view.put("dependencies", d.getDependencies());
            view.put("configuration", d.getConfiguration());
        }
        if (record.getLoaded() != null) {
            view.put("warnings", record.getLoaded().getWarnings());
            AuditResult audit = record.getLoaded().getAuditResult();
            view.put("findings", audit != null ? findings(audit.getFindings()) : List.of());
        }
        return view;
    }

    static List<String> capabilityKeys(PluginDescriptor d) {
        List<String> keys = new ArrayList<>();
        for (Capability c : d.getCapabilities()) {
            keys.add(c.key());
        }
        return keys;
    }

    static List<String> findings(List<AuditFinding> findings) {
        List<String> out = new ArrayList<>();
        for (AuditFinding f : findings) {
            out.add(f.toString());
        }
        return out;
    }

    /** One aligned line: id, version, state, capabilities. */
    static String row(ManagedPlugin record) {
        PluginDescriptor d = record.getDescriptor();
        String version = d != null ? d.getVersion().toString() : "-";
        String capabilities = d != null ? String.join(", ", capabilityKeys(d)) : "";
        String line = String.format("%-24s %-12s %-10s %s", record.getId(), version, record.getState(), capabilities);
        return line.stripTrailing();
    }
}
