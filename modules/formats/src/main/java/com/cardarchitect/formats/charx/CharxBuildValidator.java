package com.cardarchitect.formats.charx;

import com.cardarchitect.formats.card.CardDocument;
import com.cardarchitect.types.AssetType;
import com.cardarchitect.types.CardSpec;

import java.util.ArrayList;
import java.util.List;

public class CharxBuildValidator {

    public CharxBuildValidation validate(CardDocument card, List<ResolvedAsset> assets) {
        List<String> problems = new ArrayList<>();

        if (!card.specField().filter(CardSpec.V3.discriminator()::equals).isPresent()) {
            problems.add("Card must be CCv3 format for CHARX export");
        }

        if (assets.isEmpty()) {
            problems.add("CHARX files should contain at least one asset");
        }

        long mainIcons = assets.stream()
                .filter(a -> a.type() == AssetType.ICON && a.main())
                .count();
        if (mainIcons == 0) {
            problems.add("CHARX files should have a main icon asset");
        } else if (mainIcons > 1) {
            problems.add("CHARX files should have exactly one main icon asset, found " + mainIcons);
        }

        return new CharxBuildValidation(problems);
    }
}
