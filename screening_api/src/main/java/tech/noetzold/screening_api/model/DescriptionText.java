package tech.noetzold.screening_api.model;

public record DescriptionText(String info, String riskDescriptionInfo) {

    public static final DescriptionText EMPTY = new DescriptionText("", "");

    public DescriptionText {
        info = info == null ? "" : info;
        riskDescriptionInfo = riskDescriptionInfo == null ? "" : riskDescriptionInfo;
    }
}
