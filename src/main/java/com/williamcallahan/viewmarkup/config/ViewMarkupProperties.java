package com.williamcallahan.viewmarkup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.markup")
public class ViewMarkupProperties {

    private int maxInputLength = 100_000;
    private boolean showType = true;
    private boolean showPriority = true;

    public int getMaxInputLength() {
        return maxInputLength;
    }

    public void setMaxInputLength(int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }

    public boolean isShowType() { return showType; }
    public void setShowType(boolean showType) { this.showType = showType; }

    public boolean isShowPriority() { return showPriority; }
    public void setShowPriority(boolean showPriority) { this.showPriority = showPriority; }
}
