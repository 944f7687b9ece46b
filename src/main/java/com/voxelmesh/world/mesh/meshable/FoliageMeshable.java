package com.voxelmesh.world.mesh.meshable;

import com.voxelmesh.world.mesh.BlockModel;
import com.voxelmesh.world.mesh.BlockModels;
import com.voxelmesh.world.mesh.MeshingConfig;
import com.voxelmesh.world.mesh.QuadData;
import com.voxelmesh.world.mesh.SectionMeshBuilder;
import org.joml.Vector3f;
import org.joml.Vector3ic;

/**
 * Plants: crossed or crop-like double sided planes, pushed directly into the
 * foliage sink. Plants are never culled.
 */
public class FoliageMeshable implements BlockMeshable {

    public enum Layout { CROSS, CROP, DENSE_CROP }

    private final Layout layout;
    private final int texture;
    private final TintMode tint;
    private final boolean animated;

    private final BlockModel model;
    private final BlockModel detailedModel;

    public FoliageMeshable(Layout layout, int texture, TintMode tint, boolean animated) {
        this.layout = layout;
        this.texture = texture;
        this.tint = tint;
        this.animated = animated;

        this.model = switch (layout) {
            case CROSS -> BlockModels.cross(texture);
            case CROP -> BlockModels.crop(texture, false);
            case DENSE_CROP -> BlockModels.crop(texture, true);
        };
        this.detailedModel = model.subdivideV();
    }

    public Layout getLayout() {
        return layout;
    }

    /** The model used at the given quality. */
    public BlockModel getModel(MeshingConfig.Quality quality) {
        return quality == MeshingConfig.Quality.HIGH ? detailedModel : model;
    }

    @Override
    public void createMesh(Vector3ic position, BlockMeshInfo info, SectionMeshBuilder builder) {
        int tintColor = tint == TintMode.NEUTRAL ? builder.getBlockTint(position) : 0;

        getModel(builder.getConfig().foliageQuality).push(
            builder.getFoliageMeshing(),
            new Vector3f(position.x(), position.y(), position.z()),
            data -> {
                int result = QuadData.withAnimation(data, animated);
                return tint == TintMode.NEUTRAL ? QuadData.withTint(result, tintColor) : result;
            });
    }

    @Override
    public String toString() {
        return "Foliage[" + layout + ", texture " + texture + "]";
    }
}
