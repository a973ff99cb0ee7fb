package com.glitchtrip;

import java.util.Random;

/**
 * Moves square tiles of the image by a random offset of up to half a tile.
 * Tiles are visited in raster order and later tiles overwrite earlier ones
 * where their destinations overlap.
 */
final class BlockJitter
{

	static final int MIN_STEP = 4;

	private BlockJitter()
	{
	}

	static PixelBuffer apply(PixelBuffer src, int blockSize, Random random)
	{
		if (blockSize <= 0)
		{
			return src;
		}

		int w = src.width();
		int h = src.height();
		int[] in = src.pixels();
		int[] out = in.clone();
		int step = Math.max(MIN_STEP, blockSize);

		for (int y = 0; y < h; y += step)
		{
			for (int x = 0; x < w; x += step)
			{
				int bw = Math.min(step, w - x);
				int bh = Math.min(step, h - y);
				int jx = random.nextInt(step) - step / 2;
				int jy = random.nextInt(step) - step / 2;
				int dstX = PixelBuffer.clamp(x + jx, 0, w - bw);
				int dstY = PixelBuffer.clamp(y + jy, 0, h - bh);
				copyTile(in, out, w, x, y, dstX, dstY, bw, bh);
			}
		}
		return new PixelBuffer(w, h, out);
	}

	private static void copyTile(int[] in, int[] out, int w, int srcX, int srcY,
								 int dstX, int dstY, int bw, int bh)
	{
		for (int row = 0; row < bh; row++)
		{
			System.arraycopy(in, (srcY + row) * w + srcX, out, (dstY + row) * w + dstX, bw);
		}
	}
}
