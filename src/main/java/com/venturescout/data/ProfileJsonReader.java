package com.venturescout.data;

import com.venturescout.model.CompanyProfile;
import com.venturescout.model.FounderProfile;
import com.venturescout.model.OrganizationProfile;
import com.venturescout.model.PortfolioHolding;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads organization and candidate profiles from JSON documents.
 * <p>
 * Candidates come either as a bare array or under a {@code candidates} key. Organization fields
 * accept both the preferred names and the older aliases ({@code focus_areas},
 * {@code investment_stages}, {@code geographic_focus}, {@code portfolio_companies}).
 */
public final class ProfileJsonReader {

    public OrganizationProfile readOrganization(Path file) throws IOException {
        String raw = Files.readString(file, StandardCharsets.UTF_8);
        JSONObject root = new JSONObject(raw);
        JSONObject org = root.optJSONObject("organization");
        return parseOrganization(org == null ? root : org);
    }

    public List<CompanyProfile> readCandidates(Path file) throws IOException {
        String raw = Files.readString(file, StandardCharsets.UTF_8).trim();
        JSONArray arr;
        if (raw.startsWith("[")) {
            arr = new JSONArray(raw);
        } else {
            JSONObject root = new JSONObject(raw);
            arr = root.optJSONArray("candidates");
            if (arr == null) {
                arr = new JSONArray();
            }
        }
        return parseCandidates(arr);
    }

    public OrganizationProfile parseOrganization(JSONObject o) {
        return OrganizationProfile.builder()
                .name(o.optString("name", ""))
                .investmentThesis(firstString(o, "investment_thesis", "thesis"))
                .preferredIndustries(stringList(o, "preferred_industries", "focus_areas"))
                .preferredStages(stringList(o, "preferred_stages", "investment_stages"))
                .preferredLocations(stringList(o, "preferred_locations", "geographic_focus"))
                .portfolio(holdings(o))
                .build();
    }

    public List<CompanyProfile> parseCandidates(JSONArray arr) {
        List<CompanyProfile> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject item = arr.optJSONObject(i);
            if (item == null) {
                // keep the slot so validation reports the position
                out.add(CompanyProfile.builder().build());
                continue;
            }
            out.add(parseCandidate(item));
        }
        return out;
    }

    public CompanyProfile parseCandidate(JSONObject o) {
        JSONObject company = o.optJSONObject("company");
        JSONObject c = company == null ? o : company;
        JSONArray founderArr = o.optJSONArray("founders");
        if (founderArr == null) {
            founderArr = c.optJSONArray("founders");
        }
        List<FounderProfile> founders = new ArrayList<>();
        if (founderArr != null) {
            for (int i = 0; i < founderArr.length(); i++) {
                JSONObject f = founderArr.optJSONObject(i);
                if (f != null) {
                    founders.add(parseFounder(f));
                }
            }
        }
        return CompanyProfile.builder()
                .name(c.optString("name", ""))
                .description(c.optString("description", ""))
                .industry(c.optString("industry", ""))
                .location(c.optString("location", ""))
                .foundedYear(c.optInt("founded_year", 0))
                .fundingStage(c.optString("funding_stage", ""))
                .website(c.optString("website", ""))
                .founders(founders)
                .build();
    }

    public FounderProfile parseFounder(JSONObject f) {
        return FounderProfile.builder()
                .name(f.optString("name", ""))
                .title(f.optString("title", ""))
                .experience(f.optString("experience", ""))
                .education(f.optString("education", ""))
                .honors(f.optString("honors", ""))
                .linkedinConnections(f.optInt("linkedin_connections", 0))
                .endorsements(f.optInt("endorsements", 0))
                .build();
    }

    private static List<PortfolioHolding> holdings(JSONObject o) {
        JSONArray arr = o.optJSONArray("portfolio");
        if (arr == null) {
            arr = o.optJSONArray("portfolio_companies");
        }
        List<PortfolioHolding> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.length(); i++) {
            Object item = arr.opt(i);
            if (item instanceof JSONObject h) {
                out.add(new PortfolioHolding(
                        h.optString("name", ""),
                        h.optString("industry", ""),
                        h.optString("description", "")
                ));
            } else if (item instanceof String s) {
                out.add(PortfolioHolding.named(s));
            }
        }
        return out;
    }

    private static String firstString(JSONObject o, String... keys) {
        for (String key : keys) {
            String value = o.optString(key, "").trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static List<String> stringList(JSONObject o, String... keys) {
        for (String key : keys) {
            JSONArray arr = o.optJSONArray(key);
            if (arr == null) {
                continue;
            }
            List<String> out = new ArrayList<>();
            for (int i = 0; i < arr.length(); i++) {
                String value = arr.optString(i, "").trim();
                if (!value.isEmpty()) {
                    out.add(value);
                }
            }
            return out;
        }
        return List.of();
    }
}
