package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.ImageType;
import com.example.gridfill.engine.grid.Region;
import lombok.Getter;

import java.util.Map;

@Getter
public class ImageCommand extends CommandNode {
    private final String src;
    private final ImageType imageType;
    private final double scaleX;
    private final double scaleY;

    ImageCommand(Region region, Map<String, String> attributes, ImageType imageType, double scaleX, double scaleY) {
        super(CommandType.IMAGE, region, attributes);
        this.src = attributes.get("src");
        this.imageType = imageType;
        this.scaleX = scaleX;
        this.scaleY = scaleY;
    }

    @Override
    public <R, A> R accept(CommandVisitor<R, A> visitor, A arg) {
        return visitor.visitImage(this, arg);
    }
}
